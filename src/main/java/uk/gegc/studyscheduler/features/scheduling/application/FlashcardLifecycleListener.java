package uk.gegc.studyscheduler.features.scheduling.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.studyscheduler.features.scheduling.domain.event.FlashcardCreatedEvent;
import uk.gegc.studyscheduler.features.scheduling.domain.event.FlashcardDeletedEvent;
import uk.gegc.studyscheduler.features.scheduling.domain.model.SchedulingSnapshot;
import uk.gegc.studyscheduler.features.scheduling.domain.model.SchedulingState;
import uk.gegc.studyscheduler.features.scheduling.domain.repository.ReviewLogRepository;
import uk.gegc.studyscheduler.features.scheduling.domain.repository.SchedulingStateRepository;

import java.time.Clock;
import java.time.Instant;

/**
 * Keeps scheduling rows in step with the flashcard module: a default state for each new card,
 * removal of state and history together with the card.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FlashcardLifecycleListener {

    private final Clock clock;
    private final SchedulingStateRepository stateRepository;
    private final ReviewLogRepository reviewLogRepository;
    private final SrsAlgorithm srsAlgorithm;

    @Async("generalTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onFlashcardCreated(FlashcardCreatedEvent event) {
        if (stateRepository.findByUserIdAndFlashcardId(event.getOwnerId(), event.getFlashcardId()).isPresent()) {
            return;
        }
        SchedulingSnapshot initial = srsAlgorithm.initialState(Instant.now(clock));
        SchedulingState state = new SchedulingState();
        state.setUserId(event.getOwnerId());
        state.setFlashcardId(event.getFlashcardId());
        state.setEaseFactor(initial.easeFactor());
        state.setIntervalDays(initial.intervalDays());
        state.setRepetitions(initial.repetitions());
        state.setDueDate(initial.dueDate());
        state.setLastReviewedAt(null);
        state.setTimesReviewed(0);
        state.setTimesCorrect(0);
        try {
            stateRepository.save(state);
            log.debug("Initialised scheduling state for flashcard {}", event.getFlashcardId());
        } catch (DataIntegrityViolationException e) {
            // a first review got there before us and created the row lazily
            log.debug("Scheduling state for flashcard {} already exists: {}",
                    event.getFlashcardId(), e.getMostSpecificCause().getMessage());
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.BEFORE_COMMIT, fallbackExecution = true)
    public void onFlashcardDeleted(FlashcardDeletedEvent event) {
        int states = stateRepository.deleteByFlashcardId(event.getFlashcardId());
        int logs = reviewLogRepository.deleteByFlashcardId(event.getFlashcardId());
        log.info("Removed {} scheduling state(s) and {} review log(s) for deleted flashcard {}",
                states, logs, event.getFlashcardId());
    }
}

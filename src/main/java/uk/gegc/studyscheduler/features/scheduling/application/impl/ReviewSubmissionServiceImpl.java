package uk.gegc.studyscheduler.features.scheduling.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Lazy;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.studyscheduler.features.scheduling.application.FlashcardOwnershipPort;
import uk.gegc.studyscheduler.features.scheduling.application.MaturityClassifier;
import uk.gegc.studyscheduler.features.scheduling.application.ReviewSubmissionService;
import uk.gegc.studyscheduler.features.scheduling.application.SrsAlgorithm;
import uk.gegc.studyscheduler.features.scheduling.application.dto.ReviewOutcome;
import uk.gegc.studyscheduler.features.scheduling.application.exception.FlashcardNotFoundException;
import uk.gegc.studyscheduler.features.scheduling.application.exception.ReviewConflictException;
import uk.gegc.studyscheduler.features.scheduling.config.SchedulingProperties;
import uk.gegc.studyscheduler.features.scheduling.domain.event.ReviewCompletedEvent;
import uk.gegc.studyscheduler.features.scheduling.domain.model.CardMaturity;
import uk.gegc.studyscheduler.features.scheduling.domain.model.ReviewRating;
import uk.gegc.studyscheduler.features.scheduling.domain.model.SchedulingSnapshot;
import uk.gegc.studyscheduler.features.scheduling.domain.model.SchedulingState;
import uk.gegc.studyscheduler.features.scheduling.domain.repository.SchedulingStateRepository;
import uk.gegc.studyscheduler.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.function.Supplier;

@Service
@RequiredArgsConstructor
@Slf4j
public class ReviewSubmissionServiceImpl implements ReviewSubmissionService {

    private final Clock clock;
    private final SchedulingStateRepository stateRepository;
    private final FlashcardOwnershipPort flashcardOwnershipPort;
    private final SrsAlgorithm srsAlgorithm;
    private final MaturityClassifier maturityClassifier;
    private final ApplicationEventPublisher eventPublisher;
    private final SchedulingProperties properties;

    @Lazy
    private final ReviewSubmissionService self;

    @Override
    public ReviewOutcome submitReview(UUID userId, UUID flashcardId, ReviewRating rating) {
        if (flashcardId == null) {
            throw new ValidationException("flashcardId is required");
        }
        if (rating == null) {
            throw new ValidationException("Rating is required");
        }
        return withRetry(flashcardId, () -> self.submitReviewTx(userId, flashcardId, rating));
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ReviewOutcome submitReviewTx(UUID userId, UUID flashcardId, ReviewRating rating) {
        if (!flashcardOwnershipPort.isOwnedBy(flashcardId, userId)) {
            throw new FlashcardNotFoundException(flashcardId);
        }

        Instant reviewedAt = Instant.now(clock);
        SchedulingState state = stateRepository.findByUserIdAndFlashcardId(userId, flashcardId)
                .orElseGet(() -> newDefaultState(userId, flashcardId, reviewedAt));
        boolean lazilyCreated = state.getId() == null;

        SchedulingSnapshot next = srsAlgorithm.advance(SchedulingSnapshot.of(state), rating, reviewedAt);
        applyResults(state, next);

        try {
            stateRepository.saveAndFlush(state);
        } catch (DataIntegrityViolationException e) {
            if (lazilyCreated) {
                // Another submission created the row first; retrying will load and advance it
                throw new OptimisticLockingFailureException(
                        "Scheduling state for flashcard " + flashcardId + " was created concurrently", e);
            }
            throw e;
        }

        CardMaturity maturity = maturityClassifier.maturityOf(next.repetitions(), next.intervalDays());
        eventPublisher.publishEvent(new ReviewCompletedEvent(
                this,
                userId,
                flashcardId,
                rating,
                maturity,
                next.intervalDays(),
                next.easeFactor(),
                next.repetitions(),
                reviewedAt
        ));

        log.debug("Review {} applied to flashcard {} for user {}: interval={}d, ease={}, reps={}",
                rating, flashcardId, userId, next.intervalDays(), next.easeFactor(), next.repetitions());
        return new ReviewOutcome(flashcardId, next, maturity);
    }

    private <T> T withRetry(UUID flashcardId, Supplier<T> action) {
        int maxAttempts = properties.getSubmission().getMaxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (OptimisticLockingFailureException e) {
                if (attempt == maxAttempts) {
                    log.warn("Giving up on review for flashcard {} after {} conflicting attempts", flashcardId, attempt);
                    throw new ReviewConflictException(flashcardId, attempt, e);
                }
                log.warn("Optimistic lock conflict on flashcard {} (attempt {}/{}), retrying",
                        flashcardId, attempt, maxAttempts);
                sleepBackoff(attempt);
            }
        }
        throw new IllegalStateException("Retry loop exhausted unexpectedly");
    }

    private void sleepBackoff(int attempt) {
        try {
            Thread.sleep(properties.getSubmission().getBackoff().toMillis() * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private SchedulingState newDefaultState(UUID userId, UUID flashcardId, Instant now) {
        SchedulingSnapshot initial = srsAlgorithm.initialState(now);
        SchedulingState state = new SchedulingState();
        state.setUserId(userId);
        state.setFlashcardId(flashcardId);
        applyResults(state, initial);
        return state;
    }

    private void applyResults(SchedulingState state, SchedulingSnapshot snapshot) {
        state.setEaseFactor(snapshot.easeFactor());
        state.setIntervalDays(snapshot.intervalDays());
        state.setRepetitions(snapshot.repetitions());
        state.setDueDate(snapshot.dueDate());
        state.setLastReviewedAt(snapshot.lastReviewedAt());
        state.setTimesReviewed(snapshot.timesReviewed());
        state.setTimesCorrect(snapshot.timesCorrect());
    }
}

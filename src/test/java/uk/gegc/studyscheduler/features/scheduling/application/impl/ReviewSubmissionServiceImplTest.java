package uk.gegc.studyscheduler.features.scheduling.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import uk.gegc.studyscheduler.BaseUnitTest;
import uk.gegc.studyscheduler.features.scheduling.application.FlashcardOwnershipPort;
import uk.gegc.studyscheduler.features.scheduling.application.MaturityClassifier;
import uk.gegc.studyscheduler.features.scheduling.application.ReviewSubmissionService;
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
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("ReviewSubmissionServiceImpl Tests")
class ReviewSubmissionServiceImplTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2025-05-20T10:15:30Z");

    @Mock
    private SchedulingStateRepository stateRepository;
    @Mock
    private FlashcardOwnershipPort flashcardOwnershipPort;
    @Mock
    private ApplicationEventPublisher eventPublisher;
    @Mock
    private ReviewSubmissionService self;

    private ReviewSubmissionServiceImpl service;
    private UUID userId;
    private UUID flashcardId;

    @BeforeEach
    void setUp() {
        SchedulingProperties properties = new SchedulingProperties();
        properties.getSubmission().setBackoff(Duration.ofMillis(1));

        service = new ReviewSubmissionServiceImpl(
                Clock.fixed(NOW, ZoneOffset.UTC),
                stateRepository,
                flashcardOwnershipPort,
                new Sm2Algorithm(properties),
                new MaturityClassifier(),
                eventPublisher,
                properties,
                self
        );
        userId = UUID.randomUUID();
        flashcardId = UUID.randomUUID();
    }

    private SchedulingState existingState(int intervalDays, double easeFactor, int repetitions) {
        SchedulingState state = new SchedulingState();
        state.setId(UUID.randomUUID());
        state.setUserId(userId);
        state.setFlashcardId(flashcardId);
        state.setEaseFactor(easeFactor);
        state.setIntervalDays(intervalDays);
        state.setRepetitions(repetitions);
        state.setDueDate(NOW.minus(1, ChronoUnit.DAYS));
        state.setLastReviewedAt(NOW.minus(intervalDays + 1L, ChronoUnit.DAYS));
        state.setTimesReviewed(repetitions);
        state.setTimesCorrect(repetitions);
        state.setVersion(3L);
        return state;
    }

    private ReviewOutcome sampleOutcome() {
        SchedulingSnapshot state = new SchedulingSnapshot(2.5, 1, 1, NOW.plus(1, ChronoUnit.DAYS), NOW, 1, 1);
        return new ReviewOutcome(flashcardId, state, CardMaturity.LEARNING);
    }

    @Test
    @DisplayName("submitReviewTx advances an existing state and saves it")
    void submitReviewTx_existingState_advancesAndSaves() {
        SchedulingState state = existingState(10, 2.5, 3);
        when(flashcardOwnershipPort.isOwnedBy(flashcardId, userId)).thenReturn(true);
        when(stateRepository.findByUserIdAndFlashcardId(userId, flashcardId)).thenReturn(Optional.of(state));
        when(stateRepository.saveAndFlush(state)).thenReturn(state);

        ReviewOutcome outcome = service.submitReviewTx(userId, flashcardId, ReviewRating.HARD);

        assertEquals(20, outcome.state().intervalDays());
        assertEquals(2.35, outcome.state().easeFactor(), 1e-9);
        assertEquals(CardMaturity.YOUNG, outcome.maturity());
        assertThat(state.getIntervalDays()).isEqualTo(20);
        assertThat(state.getRepetitions()).isEqualTo(4);
        assertThat(state.getTimesReviewed()).isEqualTo(4);
        assertThat(state.getLastReviewedAt()).isEqualTo(NOW);
        assertThat(state.getDueDate()).isEqualTo(NOW.plus(20, ChronoUnit.DAYS));
    }

    @Test
    @DisplayName("submitReviewTx lazily creates a default state on the first review")
    void submitReviewTx_missingState_createsLazily() {
        when(flashcardOwnershipPort.isOwnedBy(flashcardId, userId)).thenReturn(true);
        when(stateRepository.findByUserIdAndFlashcardId(userId, flashcardId)).thenReturn(Optional.empty());
        when(stateRepository.saveAndFlush(any(SchedulingState.class))).thenAnswer(inv -> inv.getArgument(0));

        ReviewOutcome outcome = service.submitReviewTx(userId, flashcardId, ReviewRating.GOOD);

        ArgumentCaptor<SchedulingState> saved = ArgumentCaptor.forClass(SchedulingState.class);
        verify(stateRepository).saveAndFlush(saved.capture());
        assertThat(saved.getValue().getUserId()).isEqualTo(userId);
        assertThat(saved.getValue().getFlashcardId()).isEqualTo(flashcardId);
        assertThat(saved.getValue().getIntervalDays()).isEqualTo(1);
        assertThat(saved.getValue().getRepetitions()).isEqualTo(1);
        assertThat(saved.getValue().getTimesReviewed()).isEqualTo(1);
        assertThat(saved.getValue().getTimesCorrect()).isEqualTo(1);
        assertThat(outcome.maturity()).isEqualTo(CardMaturity.LEARNING);
    }

    @Test
    @DisplayName("submitReviewTx publishes ReviewCompletedEvent with the committed values")
    void submitReviewTx_publishesEvent() {
        SchedulingState state = existingState(10, 2.5, 3);
        when(flashcardOwnershipPort.isOwnedBy(flashcardId, userId)).thenReturn(true);
        when(stateRepository.findByUserIdAndFlashcardId(userId, flashcardId)).thenReturn(Optional.of(state));
        when(stateRepository.saveAndFlush(state)).thenReturn(state);

        service.submitReviewTx(userId, flashcardId, ReviewRating.AGAIN);

        ArgumentCaptor<ReviewCompletedEvent> captor = ArgumentCaptor.forClass(ReviewCompletedEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        ReviewCompletedEvent event = captor.getValue();
        assertThat(event.getUserId()).isEqualTo(userId);
        assertThat(event.getFlashcardId()).isEqualTo(flashcardId);
        assertThat(event.getRating()).isEqualTo(ReviewRating.AGAIN);
        assertThat(event.getMaturity()).isEqualTo(CardMaturity.NEW);
        assertThat(event.getIntervalDays()).isEqualTo(1);
        assertThat(event.getReviewedAt()).isEqualTo(NOW);
        assertThat(event.isStreakRelevant()).isFalse();
    }

    @Test
    @DisplayName("submitReviewTx rejects flashcards the user does not own without touching state")
    void submitReviewTx_notOwned_throwsNotFound() {
        when(flashcardOwnershipPort.isOwnedBy(flashcardId, userId)).thenReturn(false);

        assertThatThrownBy(() -> service.submitReviewTx(userId, flashcardId, ReviewRating.GOOD))
                .isInstanceOf(FlashcardNotFoundException.class)
                .hasMessageContaining(flashcardId.toString());

        verifyNoInteractions(stateRepository, eventPublisher);
    }

    @Test
    @DisplayName("Duplicate insert racing a lazy creation surfaces as an optimistic lock failure")
    void submitReviewTx_duplicateLazyInsert_isRetryable() {
        when(flashcardOwnershipPort.isOwnedBy(flashcardId, userId)).thenReturn(true);
        when(stateRepository.findByUserIdAndFlashcardId(userId, flashcardId)).thenReturn(Optional.empty());
        when(stateRepository.saveAndFlush(any(SchedulingState.class)))
                .thenThrow(new DataIntegrityViolationException("uq_scheduling_state_user_flashcard"));

        assertThatThrownBy(() -> service.submitReviewTx(userId, flashcardId, ReviewRating.GOOD))
                .isInstanceOf(OptimisticLockingFailureException.class)
                .hasCauseInstanceOf(DataIntegrityViolationException.class);
        verify(eventPublisher, never()).publishEvent(any());
    }

    @Test
    @DisplayName("Integrity violation on an existing row is not treated as a conflict")
    void submitReviewTx_integrityViolationOnExistingRow_propagates() {
        SchedulingState state = existingState(6, 2.5, 2);
        when(flashcardOwnershipPort.isOwnedBy(flashcardId, userId)).thenReturn(true);
        when(stateRepository.findByUserIdAndFlashcardId(userId, flashcardId)).thenReturn(Optional.of(state));
        when(stateRepository.saveAndFlush(state)).thenThrow(new DataIntegrityViolationException("check failed"));

        assertThatThrownBy(() -> service.submitReviewTx(userId, flashcardId, ReviewRating.GOOD))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("submitReview retries after an optimistic lock conflict and returns the second result")
    void submitReview_conflictThenSuccess_retries() {
        ReviewOutcome outcome = sampleOutcome();
        when(self.submitReviewTx(userId, flashcardId, ReviewRating.GOOD))
                .thenThrow(new OptimisticLockingFailureException("stale version"))
                .thenReturn(outcome);

        ReviewOutcome result = service.submitReview(userId, flashcardId, ReviewRating.GOOD);

        assertSame(outcome, result);
        verify(self, times(2)).submitReviewTx(userId, flashcardId, ReviewRating.GOOD);
    }

    @Test
    @DisplayName("submitReview gives up with ReviewConflictException after three conflicts")
    void submitReview_exhaustedRetries_throwsConflict() {
        when(self.submitReviewTx(userId, flashcardId, ReviewRating.EASY))
                .thenThrow(new OptimisticLockingFailureException("stale version"));

        assertThatThrownBy(() -> service.submitReview(userId, flashcardId, ReviewRating.EASY))
                .isInstanceOfSatisfying(ReviewConflictException.class, ex -> {
                    assertThat(ex.getFlashcardId()).isEqualTo(flashcardId);
                    assertThat(ex.getAttempts()).isEqualTo(3);
                    assertThat(ex.getCause()).isInstanceOf(OptimisticLockingFailureException.class);
                });
        verify(self, times(3)).submitReviewTx(userId, flashcardId, ReviewRating.EASY);
    }

    @Test
    @DisplayName("submitReview does not retry non-conflict failures")
    void submitReview_notFound_notRetried() {
        when(self.submitReviewTx(userId, flashcardId, ReviewRating.GOOD))
                .thenThrow(new FlashcardNotFoundException(flashcardId));

        assertThatThrownBy(() -> service.submitReview(userId, flashcardId, ReviewRating.GOOD))
                .isInstanceOf(FlashcardNotFoundException.class);
        verify(self, times(1)).submitReviewTx(userId, flashcardId, ReviewRating.GOOD);
    }

    @Test
    @DisplayName("submitReview rejects a missing rating or flashcard id up front")
    void submitReview_missingInput_throwsValidation() {
        assertThatThrownBy(() -> service.submitReview(userId, flashcardId, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.submitReview(userId, null, ReviewRating.GOOD))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(self, stateRepository);
    }
}

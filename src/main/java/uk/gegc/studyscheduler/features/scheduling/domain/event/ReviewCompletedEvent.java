package uk.gegc.studyscheduler.features.scheduling.domain.event;

import org.springframework.context.ApplicationEvent;
import uk.gegc.studyscheduler.features.scheduling.domain.model.CardMaturity;
import uk.gegc.studyscheduler.features.scheduling.domain.model.ReviewRating;

import java.time.Instant;
import java.util.UUID;

/**
 * Domain event published when a review has been applied to a card's scheduling state.
 * <p>
 * Listeners receive it only after the state write commits, on the general executor, so
 * achievements, analytics and history recording never hold up or roll back a submission.
 * Delivery is at-least-once: a consumer may see the same review twice and must be idempotent,
 * using {@code (userId, flashcardId, reviewedAt)} as the review identity.
 * </p>
 */
public class ReviewCompletedEvent extends ApplicationEvent {

    private final UUID userId;
    private final UUID flashcardId;
    private final ReviewRating rating;
    private final CardMaturity maturity;
    private final int intervalDays;
    private final double easeFactor;
    private final int repetitions;
    private final Instant reviewedAt;

    public ReviewCompletedEvent(Object source,
                                UUID userId,
                                UUID flashcardId,
                                ReviewRating rating,
                                CardMaturity maturity,
                                int intervalDays,
                                double easeFactor,
                                int repetitions,
                                Instant reviewedAt) {
        super(source);
        this.userId = userId;
        this.flashcardId = flashcardId;
        this.rating = rating;
        this.maturity = maturity;
        this.intervalDays = intervalDays;
        this.easeFactor = easeFactor;
        this.repetitions = repetitions;
        this.reviewedAt = reviewedAt;
    }

    public UUID getUserId() {
        return userId;
    }

    public UUID getFlashcardId() {
        return flashcardId;
    }

    public ReviewRating getRating() {
        return rating;
    }

    public CardMaturity getMaturity() {
        return maturity;
    }

    public int getIntervalDays() {
        return intervalDays;
    }

    public double getEaseFactor() {
        return easeFactor;
    }

    public int getRepetitions() {
        return repetitions;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }

    /**
     * Whether the review counts towards a study streak, i.e. it was not a lapse.
     */
    public boolean isStreakRelevant() {
        return !rating.isLapse();
    }
}

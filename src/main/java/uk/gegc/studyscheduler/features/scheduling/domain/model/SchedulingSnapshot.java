package uk.gegc.studyscheduler.features.scheduling.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable view of a card's memory parameters. The SM-2 algorithm and the classifier work on
 * snapshots only, so neither touches persistence.
 */
public record SchedulingSnapshot(
        double easeFactor,
        int intervalDays,
        int repetitions,
        Instant dueDate,
        Instant lastReviewedAt,
        int timesReviewed,
        int timesCorrect
) {

    /**
     * Never-reviewed state: due immediately, no interval, no history.
     */
    public static SchedulingSnapshot initial(double easeFactor, Instant now) {
        return new SchedulingSnapshot(easeFactor, 0, 0, now, null, 0, 0);
    }

    public static SchedulingSnapshot of(SchedulingState state) {
        return new SchedulingSnapshot(
                state.getEaseFactor(),
                state.getIntervalDays(),
                state.getRepetitions(),
                state.getDueDate(),
                state.getLastReviewedAt(),
                state.getTimesReviewed(),
                state.getTimesCorrect()
        );
    }

    /**
     * Whole days elapsed since the due date, 0 for cards that are due today or not yet due.
     */
    public long daysOverdue(Instant now) {
        return Math.max(0L, Duration.between(dueDate, now).toDays());
    }

    /**
     * Fraction of reviews that were not lapses, 0 when the card has never been reviewed.
     */
    public double successRate() {
        return timesReviewed == 0 ? 0.0 : (double) timesCorrect / timesReviewed;
    }
}

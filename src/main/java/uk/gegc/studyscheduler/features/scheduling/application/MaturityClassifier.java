package uk.gegc.studyscheduler.features.scheduling.application;

import org.springframework.stereotype.Component;
import uk.gegc.studyscheduler.features.scheduling.domain.model.CardMaturity;
import uk.gegc.studyscheduler.features.scheduling.domain.model.SchedulingSnapshot;

import java.time.Duration;
import java.time.Instant;

/**
 * Derives the maturity bucket and an exponential-forgetting retention estimate from a snapshot.
 * Nothing here is stored; both values are recomputed on every read.
 */
@Component
public class MaturityClassifier {

    static final int YOUNG_THRESHOLD_DAYS = 7;
    static final int MATURE_THRESHOLD_DAYS = 21;

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    public CardClassification classify(SchedulingSnapshot state, Instant now) {
        return new CardClassification(
                maturityOf(state.repetitions(), state.intervalDays()),
                estimateRetention(state, now)
        );
    }

    public CardMaturity maturityOf(int repetitions, int intervalDays) {
        if (repetitions == 0) return CardMaturity.NEW;
        if (intervalDays < YOUNG_THRESHOLD_DAYS) return CardMaturity.LEARNING;
        if (intervalDays < MATURE_THRESHOLD_DAYS) return CardMaturity.YOUNG;
        return CardMaturity.MATURE;
    }

    /**
     * {@code exp(-daysSinceLastReview / max(1, intervalDays))}, clamped to [0, 1].
     * A card that was never reviewed has nothing to retain and scores 0.
     */
    public double estimateRetention(SchedulingSnapshot state, Instant now) {
        if (state.lastReviewedAt() == null) {
            return 0.0;
        }
        double daysSince = Math.max(0.0, Duration.between(state.lastReviewedAt(), now).toMillis() / MILLIS_PER_DAY);
        double stability = Math.max(1, state.intervalDays());
        double retention = Math.exp(-daysSince / stability);
        return Math.max(0.0, Math.min(1.0, retention));
    }
}

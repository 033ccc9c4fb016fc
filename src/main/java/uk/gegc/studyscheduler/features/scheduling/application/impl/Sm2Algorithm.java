package uk.gegc.studyscheduler.features.scheduling.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.studyscheduler.features.scheduling.application.SrsAlgorithm;
import uk.gegc.studyscheduler.features.scheduling.application.exception.InvalidSchedulingStateException;
import uk.gegc.studyscheduler.features.scheduling.config.SchedulingProperties;
import uk.gegc.studyscheduler.features.scheduling.domain.model.ReviewRating;
import uk.gegc.studyscheduler.features.scheduling.domain.model.SchedulingSnapshot;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * SM-2 variant driven by four ratings. Successful reviews grow the interval with the classic
 * 1, 6, interval * ease sequence and then scale it by a per-rating multiplier; lapses reset the
 * interval and cost ease. The ease factor never drops below the configured floor.
 */
@Component
@RequiredArgsConstructor
public class Sm2Algorithm implements SrsAlgorithm {

    private static final double EASE_TOLERANCE = 1e-9;

    private final SchedulingProperties properties;

    @Override
    public SchedulingSnapshot advance(SchedulingSnapshot current, ReviewRating rating, Instant now) {
        Objects.requireNonNull(current, "current state must not be null");
        Objects.requireNonNull(rating, "rating must not be null");
        Objects.requireNonNull(now, "now must not be null");
        validate(current);

        SchedulingProperties.Sm2 policy = properties.getSm2();
        int repetitions;
        int intervalDays;
        double easeFactor;

        if (rating.isLapse()) {
            repetitions = 0;
            intervalDays = policy.getLapseIntervalDays();
            easeFactor = clampEase(current.easeFactor() - policy.getLapseEasePenalty());
        } else {
            repetitions = current.repetitions() + 1;
            long growth = baseGrowth(repetitions, current.intervalDays(), current.easeFactor());
            long scaled = Math.max(1L, Math.round(growth * intervalMultiplier(rating)));
            intervalDays = (int) Math.min(policy.getMaxIntervalDays(), scaled);
            easeFactor = clampEase(current.easeFactor() + easeDelta(rating));
        }

        return new SchedulingSnapshot(
                easeFactor,
                intervalDays,
                repetitions,
                now.plus(intervalDays, ChronoUnit.DAYS),
                now,
                current.timesReviewed() + 1,
                current.timesCorrect() + (rating.isLapse() ? 0 : 1)
        );
    }

    @Override
    public SchedulingSnapshot initialState(Instant now) {
        return SchedulingSnapshot.initial(properties.getSm2().getDefaultEaseFactor(), now);
    }

    @Override
    public Map<ReviewRating, Integer> previewIntervals(SchedulingSnapshot current, Instant now) {
        Map<ReviewRating, Integer> preview = new EnumMap<>(ReviewRating.class);
        for (ReviewRating rating : ReviewRating.values()) {
            preview.put(rating, advance(current, rating, now).intervalDays());
        }
        return preview;
    }

    private long baseGrowth(int newRepetitions, int currentIntervalDays, double currentEase) {
        SchedulingProperties.Sm2 policy = properties.getSm2();
        if (newRepetitions == 1) return policy.getFirstIntervalDays();
        if (newRepetitions == 2) return policy.getSecondIntervalDays();
        return Math.round(currentIntervalDays * currentEase);
    }

    private double intervalMultiplier(ReviewRating rating) {
        SchedulingProperties.Sm2 policy = properties.getSm2();
        return switch (rating) {
            case HARD -> policy.getHardIntervalMultiplier();
            case EASY -> policy.getEasyIntervalMultiplier();
            case GOOD, AGAIN -> 1.0;
        };
    }

    private double easeDelta(ReviewRating rating) {
        SchedulingProperties.Sm2 policy = properties.getSm2();
        return switch (rating) {
            case HARD -> policy.getHardEaseDelta();
            case EASY -> policy.getEasyEaseDelta();
            case GOOD -> 0.0;
            case AGAIN -> -policy.getLapseEasePenalty();
        };
    }

    private double clampEase(double easeFactor) {
        return Math.max(properties.getSm2().getMinEaseFactor(), easeFactor);
    }

    private void validate(SchedulingSnapshot state) {
        if (state.intervalDays() < 0) {
            throw new InvalidSchedulingStateException("intervalDays must not be negative: " + state.intervalDays());
        }
        if (state.repetitions() < 0) {
            throw new InvalidSchedulingStateException("repetitions must not be negative: " + state.repetitions());
        }
        if (state.repetitions() > 0 && state.intervalDays() <= 0) {
            throw new InvalidSchedulingStateException(
                    "intervalDays must be positive once reviewed (repetitions=" + state.repetitions() + ")");
        }
        if (Double.isNaN(state.easeFactor())
                || state.easeFactor() < properties.getSm2().getMinEaseFactor() - EASE_TOLERANCE) {
            throw new InvalidSchedulingStateException("easeFactor below floor: " + state.easeFactor());
        }
        if (state.timesReviewed() < 0 || state.timesCorrect() < 0 || state.timesCorrect() > state.timesReviewed()) {
            throw new InvalidSchedulingStateException("inconsistent review counters: correct="
                    + state.timesCorrect() + ", reviewed=" + state.timesReviewed());
        }
    }
}

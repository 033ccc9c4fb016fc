package uk.gegc.studyscheduler.features.scheduling.application;

import uk.gegc.studyscheduler.features.scheduling.domain.model.ReviewRating;
import uk.gegc.studyscheduler.features.scheduling.domain.model.SchedulingSnapshot;

import java.time.Instant;
import java.util.Map;

public interface SrsAlgorithm {

    /**
     * Applies one review to {@code current}. Pure: no I/O, same inputs always give the same output.
     */
    SchedulingSnapshot advance(SchedulingSnapshot current, ReviewRating rating, Instant now);

    SchedulingSnapshot initialState(Instant now);

    /**
     * Interval in days each rating would produce, without changing anything.
     */
    Map<ReviewRating, Integer> previewIntervals(SchedulingSnapshot current, Instant now);
}

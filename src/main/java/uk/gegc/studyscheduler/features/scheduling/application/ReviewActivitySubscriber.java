package uk.gegc.studyscheduler.features.scheduling.application;

import uk.gegc.studyscheduler.features.scheduling.domain.event.ReviewCompletedEvent;

/**
 * Consumer of committed reviews (history, achievements, analytics). Implementations may see the
 * same review more than once and must treat repeats as no-ops.
 */
public interface ReviewActivitySubscriber {

    void onReviewCompleted(ReviewCompletedEvent event);
}

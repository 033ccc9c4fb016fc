package uk.gegc.studyscheduler.features.scheduling.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import uk.gegc.studyscheduler.features.scheduling.domain.event.ReviewCompletedEvent;
import uk.gegc.studyscheduler.features.scheduling.domain.model.ReviewLog;
import uk.gegc.studyscheduler.features.scheduling.domain.repository.ReviewLogRepository;

/**
 * Writes the review history. Redelivered events hit the (user, flashcard, reviewedAt) unique key
 * and are skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReviewHistoryRecorder implements ReviewActivitySubscriber {

    private final ReviewLogRepository reviewLogRepository;

    @Override
    public void onReviewCompleted(ReviewCompletedEvent event) {
        if (reviewLogRepository.existsByUserIdAndFlashcardIdAndReviewedAt(
                event.getUserId(), event.getFlashcardId(), event.getReviewedAt())) {
            log.debug("Review of flashcard {} at {} already recorded", event.getFlashcardId(), event.getReviewedAt());
            return;
        }
        try {
            reviewLogRepository.save(buildLog(event));
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent duplicate of review {} / {} ignored: {}",
                    event.getFlashcardId(), event.getReviewedAt(), e.getMostSpecificCause().getMessage());
        }
    }

    private ReviewLog buildLog(ReviewCompletedEvent event) {
        ReviewLog reviewLog = new ReviewLog();
        reviewLog.setUserId(event.getUserId());
        reviewLog.setFlashcardId(event.getFlashcardId());
        reviewLog.setRating(event.getRating());
        reviewLog.setMaturity(event.getMaturity());
        reviewLog.setIntervalDays(event.getIntervalDays());
        reviewLog.setEaseFactor(event.getEaseFactor());
        reviewLog.setRepetitions(event.getRepetitions());
        reviewLog.setReviewedAt(event.getReviewedAt());
        return reviewLog;
    }
}

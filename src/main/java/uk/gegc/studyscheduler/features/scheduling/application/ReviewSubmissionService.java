package uk.gegc.studyscheduler.features.scheduling.application;

import uk.gegc.studyscheduler.features.scheduling.application.dto.ReviewOutcome;
import uk.gegc.studyscheduler.features.scheduling.domain.model.ReviewRating;

import java.util.UUID;

public interface ReviewSubmissionService {

    /**
     * Applies a review, retrying on concurrent modification of the same card.
     *
     * @throws uk.gegc.studyscheduler.shared.exception.ValidationException if rating or flashcard id is missing
     * @throws uk.gegc.studyscheduler.features.scheduling.application.exception.FlashcardNotFoundException
     *         if the flashcard does not exist or belongs to someone else
     * @throws uk.gegc.studyscheduler.features.scheduling.application.exception.ReviewConflictException
     *         if every attempt lost the optimistic lock
     */
    ReviewOutcome submitReview(UUID userId, UUID flashcardId, ReviewRating rating);

    /**
     * Single attempt in its own transaction. Exposed on the interface so the retry loop can
     * call it through the transactional proxy.
     */
    ReviewOutcome submitReviewTx(UUID userId, UUID flashcardId, ReviewRating rating);
}

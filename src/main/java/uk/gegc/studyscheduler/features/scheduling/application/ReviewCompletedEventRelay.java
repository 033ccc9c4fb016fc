package uk.gegc.studyscheduler.features.scheduling.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.studyscheduler.features.scheduling.domain.event.ReviewCompletedEvent;

import java.util.List;

/**
 * Fans committed reviews out to every {@link ReviewActivitySubscriber}. One failing subscriber
 * does not stop the others.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReviewCompletedEventRelay {

    private final List<ReviewActivitySubscriber> subscribers;

    @Async("generalTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onReviewCompleted(ReviewCompletedEvent event) {
        for (ReviewActivitySubscriber subscriber : subscribers) {
            try {
                subscriber.onReviewCompleted(event);
            } catch (RuntimeException ex) {
                log.warn("Review activity subscriber {} failed for flashcard {} (user {}): {}",
                        subscriber.getClass().getSimpleName(),
                        event.getFlashcardId(),
                        event.getUserId(),
                        ex.getMessage(),
                        ex);
            }
        }
    }
}

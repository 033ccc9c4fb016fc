package uk.gegc.studyscheduler.features.scheduling.application.exception;

import java.util.UUID;

/**
 * Thrown when a review could not be applied because concurrent submissions for the same
 * flashcard kept winning the optimistic lock until the retry limit was reached.
 * The stored scheduling state is unchanged; the caller may resubmit.
 */
public class ReviewConflictException extends RuntimeException {

    private final UUID flashcardId;
    private final int attempts;

    public ReviewConflictException(UUID flashcardId, int attempts, Throwable cause) {
        super("Review for flashcard " + flashcardId + " conflicted with concurrent updates after "
                + attempts + " attempts", cause);
        this.flashcardId = flashcardId;
        this.attempts = attempts;
    }

    public UUID getFlashcardId() {
        return flashcardId;
    }

    public int getAttempts() {
        return attempts;
    }
}

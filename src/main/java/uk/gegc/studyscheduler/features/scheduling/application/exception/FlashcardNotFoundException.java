package uk.gegc.studyscheduler.features.scheduling.application.exception;

import uk.gegc.studyscheduler.shared.exception.ResourceNotFoundException;

import java.util.UUID;

/**
 * Raised when a flashcard does not exist or belongs to another user. Both cases share one
 * exception so callers cannot probe for other users' flashcard ids.
 */
public class FlashcardNotFoundException extends ResourceNotFoundException {

    private final UUID flashcardId;

    public FlashcardNotFoundException(UUID flashcardId) {
        super("Flashcard " + flashcardId + " not found");
        this.flashcardId = flashcardId;
    }

    public UUID getFlashcardId() {
        return flashcardId;
    }
}

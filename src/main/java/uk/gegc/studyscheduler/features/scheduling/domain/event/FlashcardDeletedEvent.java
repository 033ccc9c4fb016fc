package uk.gegc.studyscheduler.features.scheduling.domain.event;

import org.springframework.context.ApplicationEvent;

import java.util.UUID;

/**
 * Published by the flashcard module inside the transaction that deletes a flashcard.
 */
public class FlashcardDeletedEvent extends ApplicationEvent {

    private final UUID flashcardId;

    public FlashcardDeletedEvent(Object source, UUID flashcardId) {
        super(source);
        this.flashcardId = flashcardId;
    }

    public UUID getFlashcardId() {
        return flashcardId;
    }
}

package uk.gegc.studyscheduler.features.scheduling.domain.event;

import org.springframework.context.ApplicationEvent;

import java.util.UUID;

/**
 * Published by the flashcard module after a new flashcard is stored.
 */
public class FlashcardCreatedEvent extends ApplicationEvent {

    private final UUID flashcardId;
    private final UUID ownerId;

    public FlashcardCreatedEvent(Object source, UUID flashcardId, UUID ownerId) {
        super(source);
        this.flashcardId = flashcardId;
        this.ownerId = ownerId;
    }

    public UUID getFlashcardId() {
        return flashcardId;
    }

    public UUID getOwnerId() {
        return ownerId;
    }
}

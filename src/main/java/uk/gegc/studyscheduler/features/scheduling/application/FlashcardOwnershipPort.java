package uk.gegc.studyscheduler.features.scheduling.application;

import java.util.UUID;

/**
 * Ownership lookup against the flashcard collaborator. The scheduler never reads flashcard
 * content, only who a card belongs to.
 */
public interface FlashcardOwnershipPort {

    /**
     * @return {@code true} only if the flashcard exists and belongs to {@code userId}
     */
    boolean isOwnedBy(UUID flashcardId, UUID userId);
}

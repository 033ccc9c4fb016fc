package uk.gegc.studyscheduler.features.scheduling.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.util.UUID;

/**
 * Read-only projection of the flashcard table owned by the content module. Only the columns
 * needed for ownership checks are mapped.
 */
@Entity
@Immutable
@Getter
@NoArgsConstructor
@Table(name = "flashcards")
public class FlashcardRef {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    public FlashcardRef(UUID id, UUID userId) {
        this.id = id;
        this.userId = userId;
    }
}

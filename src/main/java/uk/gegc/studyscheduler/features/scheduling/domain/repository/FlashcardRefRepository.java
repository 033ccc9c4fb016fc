package uk.gegc.studyscheduler.features.scheduling.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.studyscheduler.features.scheduling.domain.model.FlashcardRef;

import java.util.UUID;

public interface FlashcardRefRepository extends JpaRepository<FlashcardRef, UUID> {

    boolean existsByIdAndUserId(UUID id, UUID userId);
}

package uk.gegc.studyscheduler.features.scheduling.infra.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.studyscheduler.features.scheduling.application.FlashcardOwnershipPort;
import uk.gegc.studyscheduler.features.scheduling.domain.repository.FlashcardRefRepository;

import java.util.UUID;

@Component
@RequiredArgsConstructor
public class JpaFlashcardOwnershipAdapter implements FlashcardOwnershipPort {

    private final FlashcardRefRepository flashcardRefRepository;

    @Override
    public boolean isOwnedBy(UUID flashcardId, UUID userId) {
        if (flashcardId == null || userId == null) {
            return false;
        }
        return flashcardRefRepository.existsByIdAndUserId(flashcardId, userId);
    }
}

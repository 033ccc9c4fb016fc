package uk.gegc.studyscheduler.features.scheduling.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.studyscheduler.features.scheduling.domain.model.SchedulingState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SchedulingStateRepository extends JpaRepository<SchedulingState, UUID> {

    Optional<SchedulingState> findByUserIdAndFlashcardId(UUID userId, UUID flashcardId);

    @Query("""
            SELECT s FROM SchedulingState s
            WHERE s.userId = :userId
              AND s.dueDate <= :now
            """)
    List<SchedulingState> findDueStates(@Param("userId") UUID userId, @Param("now") Instant now);

    long countByUserIdAndDueDateLessThanEqual(UUID userId, Instant now);

    @Modifying
    @Transactional
    @Query("DELETE FROM SchedulingState s WHERE s.flashcardId = :flashcardId")
    int deleteByFlashcardId(@Param("flashcardId") UUID flashcardId);
}

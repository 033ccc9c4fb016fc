package uk.gegc.studyscheduler.features.scheduling.domain.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.studyscheduler.features.scheduling.domain.model.ReviewLog;

import java.time.Instant;
import java.util.UUID;

public interface ReviewLogRepository extends JpaRepository<ReviewLog, UUID> {

    Page<ReviewLog> findByUserIdOrderByReviewedAtDesc(UUID userId, Pageable pageable);

    boolean existsByUserIdAndFlashcardIdAndReviewedAt(UUID userId, UUID flashcardId, Instant reviewedAt);

    @Modifying
    @Transactional
    @Query("DELETE FROM ReviewLog l WHERE l.flashcardId = :flashcardId")
    int deleteByFlashcardId(@Param("flashcardId") UUID flashcardId);
}

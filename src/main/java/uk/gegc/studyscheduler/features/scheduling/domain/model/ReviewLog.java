package uk.gegc.studyscheduler.features.scheduling.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * One row per completed review. The (user, flashcard, reviewedAt) triple identifies a review,
 * which lets a redelivered completion event be ignored.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "review_log",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_review_log_user_flashcard_reviewed",
                columnNames = {"user_id", "flashcard_id", "reviewed_at"}
        ),
        indexes = @Index(name = "idx_review_log_user_reviewed", columnList = "user_id, reviewed_at")
)
public class ReviewLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "flashcard_id", nullable = false, updatable = false)
    private UUID flashcardId;

    @Enumerated(EnumType.STRING)
    @Column(name = "rating", nullable = false, length = 10)
    private ReviewRating rating;

    @Enumerated(EnumType.STRING)
    @Column(name = "maturity", nullable = false, length = 10)
    private CardMaturity maturity;

    @Column(name = "interval_days", nullable = false)
    private Integer intervalDays;

    @Column(name = "ease_factor", nullable = false)
    private Double easeFactor;

    @Column(name = "repetitions", nullable = false)
    private Integer repetitions;

    @Column(name = "reviewed_at", nullable = false, updatable = false)
    private Instant reviewedAt;
}

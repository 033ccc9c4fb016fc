package uk.gegc.studyscheduler.features.scheduling.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Getter
@Setter
@Table(
        name = "scheduling_state",
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "uq_scheduling_state_user_flashcard",
                        columnNames = {"user_id", "flashcard_id"}
                )
        },
        indexes = {
                @Index(name = "idx_scheduling_state_user_due", columnList = "user_id, due_date")
        }
)
public class SchedulingState {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", updatable = false, nullable = false)
    private UUID userId;

    @Column(name = "flashcard_id", updatable = false, nullable = false)
    private UUID flashcardId;

    @Column(name = "ease_factor", nullable = false)
    private Double easeFactor;

    @Column(name = "interval_days", nullable = false)
    private Integer intervalDays;

    @Column(name = "repetitions", nullable = false)
    private Integer repetitions;

    @Column(name = "due_date", nullable = false)
    private Instant dueDate;

    @Column(name = "last_reviewed_at")
    private Instant lastReviewedAt;

    @Column(name = "times_reviewed", nullable = false)
    private Integer timesReviewed;

    @Column(name = "times_correct", nullable = false)
    private Integer timesCorrect;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}

package uk.gegc.studyscheduler.features.scheduling.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.studyscheduler.features.scheduling.domain.model.CardMaturity;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "ReviewQueueItemDto", description = "A due flashcard with its derived review priority signals")
public record ReviewQueueItemDto(
        @Schema(description = "Flashcard ID")
        UUID flashcardId,
        @Schema(description = "Maturity bucket", example = "young")
        CardMaturity maturity,
        @Schema(description = "Whole days past the due date, 0 when due today")
        long daysOverdue,
        @Schema(description = "Estimated probability of recall in [0, 1]")
        double estimatedRetention,
        @Schema(description = "Current interval in days")
        int intervalDays,
        @Schema(description = "Ease factor (SM-2)")
        double easeFactor,
        @Schema(description = "Consecutive successful reviews since the last lapse")
        int repetitions,
        @Schema(description = "Total reviews")
        int timesReviewed,
        @Schema(description = "Share of reviews that were not lapses, 0 if never reviewed")
        double successRate,
        @Schema(description = "Due date (UTC)")
        Instant dueDate
) {
}

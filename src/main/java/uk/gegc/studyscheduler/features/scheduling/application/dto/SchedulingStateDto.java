package uk.gegc.studyscheduler.features.scheduling.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.studyscheduler.features.scheduling.domain.model.CardMaturity;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "SchedulingStateDto", description = "Current schedule of one flashcard")
public record SchedulingStateDto(
        @Schema(description = "Flashcard ID")
        UUID flashcardId,
        @Schema(description = "Maturity bucket")
        CardMaturity maturity,
        @Schema(description = "Estimated probability of recall in [0, 1]")
        double estimatedRetention,
        @Schema(description = "Ease factor (SM-2)")
        double easeFactor,
        @Schema(description = "Interval in days")
        int intervalDays,
        @Schema(description = "Consecutive successful reviews since the last lapse")
        int repetitions,
        @Schema(description = "Next due date (UTC)")
        Instant dueDate,
        @Schema(description = "Last review time (UTC), null if never reviewed")
        Instant lastReviewedAt,
        @Schema(description = "Total reviews")
        int timesReviewed,
        @Schema(description = "Reviews that were not lapses")
        int timesCorrect,
        @Schema(description = "timesCorrect / timesReviewed, 0 if never reviewed")
        double successRate,
        @Schema(description = "Whole days past the due date")
        long daysOverdue
) {
}

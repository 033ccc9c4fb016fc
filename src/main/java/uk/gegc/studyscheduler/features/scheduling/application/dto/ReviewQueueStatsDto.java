package uk.gegc.studyscheduler.features.scheduling.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "ReviewQueueStatsDto", description = "Aggregates over every due card, not only the returned batch")
public record ReviewQueueStatsDto(
        @Schema(description = "Number of due cards")
        int totalDue,
        @Schema(description = "Number of cards returned in this batch")
        int returned,
        @Schema(description = "Due cards that were never reviewed")
        long newCount,
        @Schema(description = "Due cards in the learning bucket")
        long learningCount,
        @Schema(description = "Due cards in the young bucket")
        long youngCount,
        @Schema(description = "Due cards in the mature bucket")
        long matureCount,
        @Schema(description = "Mean estimated retention across due cards, 0 when nothing is due")
        double meanRetention
) {
}

package uk.gegc.studyscheduler.features.scheduling.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "ReviewQueueDto", description = "Prioritised review batch plus statistics for the whole due set")
public record ReviewQueueDto(
        @Schema(description = "Due cards, most overdue first")
        List<ReviewQueueItemDto> items,
        @Schema(description = "Aggregate statistics")
        ReviewQueueStatsDto stats
) {
}

package uk.gegc.studyscheduler.features.scheduling.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "DailyGoalDto", description = "Recommended number of reviews for the time a user has available")
public record DailyGoalDto(
        @Schema(description = "Minutes available per day")
        int availableMinutes,
        @Schema(description = "Assumed seconds spent per card")
        int secondsPerCard,
        @Schema(description = "Cards that fit into the available time")
        int dailyReviewGoal,
        @Schema(description = "Cards due right now")
        long dueNow
) {
}

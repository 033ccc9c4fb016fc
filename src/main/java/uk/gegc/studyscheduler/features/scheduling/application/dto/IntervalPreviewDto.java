package uk.gegc.studyscheduler.features.scheduling.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.studyscheduler.features.scheduling.domain.model.ReviewRating;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "IntervalPreviewDto", description = "What each rating would do to the card, nothing is saved")
public record IntervalPreviewDto(
        @Schema(description = "Flashcard ID")
        UUID flashcardId,
        @Schema(description = "One entry per rating, in again/hard/good/easy order")
        List<RatingPreview> options
) {

    @Schema(name = "RatingPreview")
    public record RatingPreview(
            @Schema(description = "Rating", example = "good")
            ReviewRating rating,
            @Schema(description = "Resulting interval in days")
            int intervalDays,
            @Schema(description = "Human readable interval", example = "6 days")
            String label,
            @Schema(description = "Resulting due date (UTC)")
            Instant dueDate
    ) {
    }
}

package uk.gegc.studyscheduler.features.scheduling.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.studyscheduler.features.scheduling.domain.model.CardMaturity;
import uk.gegc.studyscheduler.features.scheduling.domain.model.ReviewRating;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "ReviewHistoryDto", description = "A recorded review")
public record ReviewHistoryDto(
        @Schema(description = "Review log ID")
        UUID reviewId,
        @Schema(description = "Flashcard ID")
        UUID flashcardId,
        @Schema(description = "Rating given")
        ReviewRating rating,
        @Schema(description = "Maturity after the review")
        CardMaturity maturity,
        @Schema(description = "Interval in days after the review")
        Integer intervalDays,
        @Schema(description = "Ease factor after the review")
        Double easeFactor,
        @Schema(description = "Repetitions after the review")
        Integer repetitions,
        @Schema(description = "Review time (UTC)")
        Instant reviewedAt
) {
}

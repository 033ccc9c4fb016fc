package uk.gegc.studyscheduler.features.scheduling.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.studyscheduler.features.scheduling.domain.model.CardMaturity;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "ReviewSubmissionResponse", description = "Schedule of the flashcard after the review")
public record ReviewSubmissionResponse(
        @Schema(description = "Flashcard ID")
        UUID flashcardId,
        @Schema(description = "New interval in days")
        int newIntervalDays,
        @Schema(description = "New due date (UTC)")
        Instant newDueDate,
        @Schema(description = "New ease factor")
        double newEaseFactor,
        @Schema(description = "Maturity after the review")
        CardMaturity newMaturity,
        @Schema(description = "Total reviews including this one")
        int timesReviewed,
        @Schema(description = "timesCorrect / timesReviewed")
        double successRate
) {
}

package uk.gegc.studyscheduler.features.scheduling.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

@Schema(name = "ReviewSubmissionRequest", description = "A single review of a flashcard")
public record ReviewSubmissionRequest(
        @Schema(description = "Flashcard ID", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        UUID flashcardId,
        @Schema(description = "Recall rating", requiredMode = Schema.RequiredMode.REQUIRED,
                allowableValues = {"again", "hard", "good", "easy"}, example = "good")
        @NotBlank
        String rating
) {
}

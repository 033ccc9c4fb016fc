package uk.gegc.studyscheduler.features.scheduling.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springdoc.core.annotations.ParameterObject;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import uk.gegc.studyscheduler.features.scheduling.api.dto.ReviewSubmissionRequest;
import uk.gegc.studyscheduler.features.scheduling.api.dto.ReviewSubmissionResponse;
import uk.gegc.studyscheduler.features.scheduling.application.ReviewQueueService;
import uk.gegc.studyscheduler.features.scheduling.application.ReviewSubmissionService;
import uk.gegc.studyscheduler.features.scheduling.application.SchedulingQueryService;
import uk.gegc.studyscheduler.features.scheduling.application.dto.DailyGoalDto;
import uk.gegc.studyscheduler.features.scheduling.application.dto.IntervalPreviewDto;
import uk.gegc.studyscheduler.features.scheduling.application.dto.ReviewHistoryDto;
import uk.gegc.studyscheduler.features.scheduling.application.dto.ReviewOutcome;
import uk.gegc.studyscheduler.features.scheduling.application.dto.ReviewQueueDto;
import uk.gegc.studyscheduler.features.scheduling.application.dto.SchedulingStateDto;
import uk.gegc.studyscheduler.features.scheduling.domain.model.ReviewRating;
import uk.gegc.studyscheduler.features.scheduling.infra.mapping.SchedulingDtoMapper;
import uk.gegc.studyscheduler.shared.exception.UnauthorizedException;

import java.util.Optional;
import java.util.UUID;

@Tag(name = "Scheduling", description = "Spaced repetition review queue, review submission and schedule previews")
@SecurityRequirement(name = "bearerAuth")
@RestController
@RequestMapping("/api/v1/scheduling")
@RequiredArgsConstructor
public class SchedulingController {

    private final ReviewQueueService reviewQueueService;
    private final ReviewSubmissionService reviewSubmissionService;
    private final SchedulingQueryService schedulingQueryService;
    private final SchedulingDtoMapper dtoMapper;

    private UUID resolveAuthenticatedUserId(Authentication authentication) {
        if (authentication == null) {
            throw new UnauthorizedException("Authentication required");
        }
        return safeParseUuid(authentication.getName())
                .orElseThrow(() -> new UnauthorizedException("Unknown principal"));
    }

    private static Optional<UUID> safeParseUuid(String value) {
        try {
            return Optional.of(UUID.fromString(value));
        } catch (IllegalArgumentException | NullPointerException e) {
            return Optional.empty();
        }
    }

    @GetMapping("/queue")
    @Operation(
            summary = "Get review queue",
            description = "Returns due flashcards ordered by days overdue DESC, then estimated retention ASC, "
                    + "truncated to maxSize. Stats cover every due card."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Review batch and statistics",
                    content = @Content(schema = @Schema(implementation = ReviewQueueDto.class))),
            @ApiResponse(responseCode = "400", description = "maxSize out of range",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "401", description = "Unauthorized",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ReviewQueueDto> getQueue(
            Authentication authentication,
            @Parameter(description = "Maximum number of cards to return (default 50)")
            @RequestParam(required = false) Integer maxSize
    ) {
        UUID userId = resolveAuthenticatedUserId(authentication);
        return ResponseEntity.ok(reviewQueueService.buildQueue(userId, maxSize));
    }

    @PostMapping("/reviews")
    @Operation(
            summary = "Submit a review",
            description = "Applies SM-2 scheduling to the flashcard. Concurrent submissions for the same card "
                    + "are retried; 409 means the retry limit was reached and nothing was changed."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Review applied",
                    content = @Content(schema = @Schema(implementation = ReviewSubmissionResponse.class))),
            @ApiResponse(responseCode = "400", description = "Validation error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "401", description = "Unauthorized",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Flashcard not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Concurrent update conflict",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "503", description = "Storage unavailable",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ReviewSubmissionResponse> submitReview(
            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    description = "Review payload",
                    required = true,
                    content = @Content(schema = @Schema(implementation = ReviewSubmissionRequest.class))
            )
            @RequestBody @Valid ReviewSubmissionRequest request,
            Authentication authentication
    ) {
        UUID userId = resolveAuthenticatedUserId(authentication);
        ReviewRating rating = ReviewRating.fromValue(request.rating());
        ReviewOutcome outcome = reviewSubmissionService.submitReview(userId, request.flashcardId(), rating);
        return ResponseEntity.ok(dtoMapper.toSubmissionResponse(outcome));
    }

    @GetMapping("/flashcards/{flashcardId}")
    @Operation(summary = "Get flashcard schedule", description = "Current scheduling state with derived maturity and retention.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Scheduling state",
                    content = @Content(schema = @Schema(implementation = SchedulingStateDto.class))),
            @ApiResponse(responseCode = "401", description = "Unauthorized",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Flashcard not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<SchedulingStateDto> getState(
            @Parameter(description = "Flashcard ID", required = true)
            @PathVariable UUID flashcardId,
            Authentication authentication
    ) {
        UUID userId = resolveAuthenticatedUserId(authentication);
        return ResponseEntity.ok(schedulingQueryService.getState(userId, flashcardId));
    }

    @GetMapping("/flashcards/{flashcardId}/preview")
    @Operation(summary = "Preview intervals", description = "Interval each rating would produce. Nothing is saved.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Per-rating preview",
                    content = @Content(schema = @Schema(implementation = IntervalPreviewDto.class))),
            @ApiResponse(responseCode = "401", description = "Unauthorized",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Flashcard not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<IntervalPreviewDto> previewIntervals(
            @Parameter(description = "Flashcard ID", required = true)
            @PathVariable UUID flashcardId,
            Authentication authentication
    ) {
        UUID userId = resolveAuthenticatedUserId(authentication);
        return ResponseEntity.ok(schedulingQueryService.previewIntervals(userId, flashcardId));
    }

    @GetMapping("/history")
    @Operation(summary = "Get review history", description = "Returns recorded reviews ordered by reviewedAt DESC.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Page of reviews",
                    content = @Content(schema = @Schema(implementation = ReviewHistoryDto.class))),
            @ApiResponse(responseCode = "401", description = "Unauthorized",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<Page<ReviewHistoryDto>> getHistory(
            Authentication authentication,
            @ParameterObject @PageableDefault(page = 0, size = 20) Pageable pageable
    ) {
        UUID userId = resolveAuthenticatedUserId(authentication);
        return ResponseEntity.ok(schedulingQueryService.getHistory(userId, pageable));
    }

    @GetMapping("/goal")
    @Operation(summary = "Daily review goal", description = "How many cards fit into the given minutes per day.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Recommended goal",
                    content = @Content(schema = @Schema(implementation = DailyGoalDto.class))),
            @ApiResponse(responseCode = "400", description = "Parameters out of range",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "401", description = "Unauthorized",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<DailyGoalDto> getDailyGoal(
            Authentication authentication,
            @Parameter(description = "Minutes available per day", required = true)
            @RequestParam int availableMinutes,
            @Parameter(description = "Seconds per card (default 10)")
            @RequestParam(required = false) Integer secondsPerCard
    ) {
        UUID userId = resolveAuthenticatedUserId(authentication);
        return ResponseEntity.ok(schedulingQueryService.dailyGoal(userId, availableMinutes, secondsPerCard));
    }
}

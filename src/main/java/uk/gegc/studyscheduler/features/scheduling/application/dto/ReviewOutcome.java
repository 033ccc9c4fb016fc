package uk.gegc.studyscheduler.features.scheduling.application.dto;

import uk.gegc.studyscheduler.features.scheduling.domain.model.CardMaturity;
import uk.gegc.studyscheduler.features.scheduling.domain.model.SchedulingSnapshot;

import java.util.UUID;

/**
 * Committed result of a review submission.
 */
public record ReviewOutcome(
        UUID flashcardId,
        SchedulingSnapshot state,
        CardMaturity maturity
) {
}

package uk.gegc.studyscheduler.features.scheduling.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.studyscheduler.features.scheduling.api.dto.ReviewSubmissionResponse;
import uk.gegc.studyscheduler.features.scheduling.application.CardClassification;
import uk.gegc.studyscheduler.features.scheduling.application.dto.ReviewHistoryDto;
import uk.gegc.studyscheduler.features.scheduling.application.dto.ReviewOutcome;
import uk.gegc.studyscheduler.features.scheduling.application.dto.ReviewQueueItemDto;
import uk.gegc.studyscheduler.features.scheduling.application.dto.SchedulingStateDto;
import uk.gegc.studyscheduler.features.scheduling.domain.model.ReviewLog;
import uk.gegc.studyscheduler.features.scheduling.domain.model.SchedulingSnapshot;

import java.time.Instant;
import java.util.UUID;

@Component
public class SchedulingDtoMapper {

    public ReviewQueueItemDto toQueueItem(
            UUID flashcardId,
            SchedulingSnapshot state,
            CardClassification classification,
            Instant now
    ) {
        return new ReviewQueueItemDto(
                flashcardId,
                classification.maturity(),
                state.daysOverdue(now),
                classification.estimatedRetention(),
                state.intervalDays(),
                state.easeFactor(),
                state.repetitions(),
                state.timesReviewed(),
                state.successRate(),
                state.dueDate()
        );
    }

    public SchedulingStateDto toStateDto(
            UUID flashcardId,
            SchedulingSnapshot state,
            CardClassification classification,
            Instant now
    ) {
        return new SchedulingStateDto(
                flashcardId,
                classification.maturity(),
                classification.estimatedRetention(),
                state.easeFactor(),
                state.intervalDays(),
                state.repetitions(),
                state.dueDate(),
                state.lastReviewedAt(),
                state.timesReviewed(),
                state.timesCorrect(),
                state.successRate(),
                state.daysOverdue(now)
        );
    }

    public ReviewSubmissionResponse toSubmissionResponse(ReviewOutcome outcome) {
        SchedulingSnapshot state = outcome.state();
        return new ReviewSubmissionResponse(
                outcome.flashcardId(),
                state.intervalDays(),
                state.dueDate(),
                state.easeFactor(),
                outcome.maturity(),
                state.timesReviewed(),
                state.successRate()
        );
    }

    public ReviewHistoryDto toHistoryDto(ReviewLog log) {
        return new ReviewHistoryDto(
                log.getId(),
                log.getFlashcardId(),
                log.getRating(),
                log.getMaturity(),
                log.getIntervalDays(),
                log.getEaseFactor(),
                log.getRepetitions(),
                log.getReviewedAt()
        );
    }
}

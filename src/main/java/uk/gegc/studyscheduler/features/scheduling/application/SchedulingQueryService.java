package uk.gegc.studyscheduler.features.scheduling.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.studyscheduler.features.scheduling.application.dto.DailyGoalDto;
import uk.gegc.studyscheduler.features.scheduling.application.dto.IntervalPreviewDto;
import uk.gegc.studyscheduler.features.scheduling.application.dto.ReviewHistoryDto;
import uk.gegc.studyscheduler.features.scheduling.application.dto.SchedulingStateDto;

import java.util.UUID;

/**
 * Read-only views over a user's schedule.
 */
public interface SchedulingQueryService {

    /**
     * Current schedule of an owned flashcard; the default state if it has never been reviewed.
     */
    SchedulingStateDto getState(UUID userId, UUID flashcardId);

    IntervalPreviewDto previewIntervals(UUID userId, UUID flashcardId);

    Page<ReviewHistoryDto> getHistory(UUID userId, Pageable pageable);

    /**
     * @param secondsPerCard {@code null} for the configured default
     */
    DailyGoalDto dailyGoal(UUID userId, int availableMinutes, Integer secondsPerCard);
}

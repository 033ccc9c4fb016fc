package uk.gegc.studyscheduler.features.scheduling.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.studyscheduler.features.scheduling.application.FlashcardOwnershipPort;
import uk.gegc.studyscheduler.features.scheduling.application.IntervalLabels;
import uk.gegc.studyscheduler.features.scheduling.application.MaturityClassifier;
import uk.gegc.studyscheduler.features.scheduling.application.SchedulingQueryService;
import uk.gegc.studyscheduler.features.scheduling.application.SrsAlgorithm;
import uk.gegc.studyscheduler.features.scheduling.application.dto.DailyGoalDto;
import uk.gegc.studyscheduler.features.scheduling.application.dto.IntervalPreviewDto;
import uk.gegc.studyscheduler.features.scheduling.application.dto.ReviewHistoryDto;
import uk.gegc.studyscheduler.features.scheduling.application.dto.SchedulingStateDto;
import uk.gegc.studyscheduler.features.scheduling.application.exception.FlashcardNotFoundException;
import uk.gegc.studyscheduler.features.scheduling.config.SchedulingProperties;
import uk.gegc.studyscheduler.features.scheduling.domain.model.ReviewRating;
import uk.gegc.studyscheduler.features.scheduling.domain.model.SchedulingSnapshot;
import uk.gegc.studyscheduler.features.scheduling.domain.repository.ReviewLogRepository;
import uk.gegc.studyscheduler.features.scheduling.domain.repository.SchedulingStateRepository;
import uk.gegc.studyscheduler.features.scheduling.infra.mapping.SchedulingDtoMapper;
import uk.gegc.studyscheduler.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SchedulingQueryServiceImpl implements SchedulingQueryService {

    static final int MAX_AVAILABLE_MINUTES = 24 * 60;
    static final int MAX_SECONDS_PER_CARD = 3600;

    private final Clock clock;
    private final SchedulingStateRepository stateRepository;
    private final ReviewLogRepository reviewLogRepository;
    private final FlashcardOwnershipPort flashcardOwnershipPort;
    private final SrsAlgorithm srsAlgorithm;
    private final MaturityClassifier maturityClassifier;
    private final SchedulingDtoMapper dtoMapper;
    private final SchedulingProperties properties;

    @Override
    public SchedulingStateDto getState(UUID userId, UUID flashcardId) {
        Instant now = Instant.now(clock);
        SchedulingSnapshot snapshot = loadOwnedSnapshot(userId, flashcardId, now);
        return dtoMapper.toStateDto(flashcardId, snapshot, maturityClassifier.classify(snapshot, now), now);
    }

    @Override
    public IntervalPreviewDto previewIntervals(UUID userId, UUID flashcardId) {
        Instant now = Instant.now(clock);
        SchedulingSnapshot snapshot = loadOwnedSnapshot(userId, flashcardId, now);
        Map<ReviewRating, Integer> intervals = srsAlgorithm.previewIntervals(snapshot, now);

        List<IntervalPreviewDto.RatingPreview> options = intervals.entrySet().stream()
                .map(entry -> new IntervalPreviewDto.RatingPreview(
                        entry.getKey(),
                        entry.getValue(),
                        IntervalLabels.format(entry.getValue()),
                        now.plus(entry.getValue(), ChronoUnit.DAYS)
                ))
                .toList();
        return new IntervalPreviewDto(flashcardId, options);
    }

    @Override
    public Page<ReviewHistoryDto> getHistory(UUID userId, Pageable pageable) {
        return reviewLogRepository.findByUserIdOrderByReviewedAtDesc(userId, pageable)
                .map(dtoMapper::toHistoryDto);
    }

    @Override
    public DailyGoalDto dailyGoal(UUID userId, int availableMinutes, Integer secondsPerCard) {
        int perCard = secondsPerCard != null ? secondsPerCard : properties.getGoal().getDefaultSecondsPerCard();
        if (availableMinutes < 0 || availableMinutes > MAX_AVAILABLE_MINUTES) {
            throw new ValidationException("availableMinutes must be between 0 and " + MAX_AVAILABLE_MINUTES);
        }
        if (perCard < 1 || perCard > MAX_SECONDS_PER_CARD) {
            throw new ValidationException("secondsPerCard must be between 1 and " + MAX_SECONDS_PER_CARD);
        }
        int goal = (availableMinutes * 60) / perCard;
        long dueNow = stateRepository.countByUserIdAndDueDateLessThanEqual(userId, Instant.now(clock));
        return new DailyGoalDto(availableMinutes, perCard, goal, dueNow);
    }

    private SchedulingSnapshot loadOwnedSnapshot(UUID userId, UUID flashcardId, Instant now) {
        if (!flashcardOwnershipPort.isOwnedBy(flashcardId, userId)) {
            throw new FlashcardNotFoundException(flashcardId);
        }
        return stateRepository.findByUserIdAndFlashcardId(userId, flashcardId)
                .map(SchedulingSnapshot::of)
                .orElseGet(() -> srsAlgorithm.initialState(now));
    }
}

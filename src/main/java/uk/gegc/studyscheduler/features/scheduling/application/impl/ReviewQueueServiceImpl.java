package uk.gegc.studyscheduler.features.scheduling.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.studyscheduler.features.scheduling.application.MaturityClassifier;
import uk.gegc.studyscheduler.features.scheduling.application.ReviewQueueService;
import uk.gegc.studyscheduler.features.scheduling.application.dto.ReviewQueueDto;
import uk.gegc.studyscheduler.features.scheduling.application.dto.ReviewQueueItemDto;
import uk.gegc.studyscheduler.features.scheduling.application.dto.ReviewQueueStatsDto;
import uk.gegc.studyscheduler.features.scheduling.config.SchedulingProperties;
import uk.gegc.studyscheduler.features.scheduling.domain.model.CardMaturity;
import uk.gegc.studyscheduler.features.scheduling.domain.model.SchedulingSnapshot;
import uk.gegc.studyscheduler.features.scheduling.domain.repository.SchedulingStateRepository;
import uk.gegc.studyscheduler.features.scheduling.infra.mapping.SchedulingDtoMapper;
import uk.gegc.studyscheduler.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class ReviewQueueServiceImpl implements ReviewQueueService {

    /**
     * Most overdue first, then lowest predicted retention. Due date and id make the order total
     * so equal cards come back in a stable order between fetches.
     */
    static final Comparator<ReviewQueueItemDto> QUEUE_ORDER = Comparator
            .comparingLong(ReviewQueueItemDto::daysOverdue).reversed()
            .thenComparingDouble(ReviewQueueItemDto::estimatedRetention)
            .thenComparing(ReviewQueueItemDto::dueDate)
            .thenComparing(ReviewQueueItemDto::flashcardId);

    private final Clock clock;
    private final SchedulingStateRepository stateRepository;
    private final MaturityClassifier maturityClassifier;
    private final SchedulingDtoMapper dtoMapper;
    private final SchedulingProperties properties;

    @Override
    public ReviewQueueDto buildQueue(UUID userId, Integer maxSize) {
        return buildQueue(userId, maxSize, Instant.now(clock));
    }

    @Override
    public ReviewQueueDto buildQueue(UUID userId, Integer maxSize, Instant now) {
        int limit = resolveMaxSize(maxSize);

        List<ReviewQueueItemDto> ranked = stateRepository.findDueStates(userId, now).stream()
                .map(state -> {
                    SchedulingSnapshot snapshot = SchedulingSnapshot.of(state);
                    return dtoMapper.toQueueItem(
                            state.getFlashcardId(),
                            snapshot,
                            maturityClassifier.classify(snapshot, now),
                            now
                    );
                })
                .sorted(QUEUE_ORDER)
                .toList();

        List<ReviewQueueItemDto> batch = ranked.size() > limit ? ranked.subList(0, limit) : ranked;
        ReviewQueueStatsDto stats = computeStats(ranked, batch.size());

        log.debug("Built review queue for user {}: {} due, {} returned", userId, stats.totalDue(), stats.returned());
        return new ReviewQueueDto(List.copyOf(batch), stats);
    }

    private ReviewQueueStatsDto computeStats(List<ReviewQueueItemDto> dueItems, int returned) {
        Map<CardMaturity, Long> counts = new EnumMap<>(CardMaturity.class);
        double retentionSum = 0.0;
        for (ReviewQueueItemDto item : dueItems) {
            counts.merge(item.maturity(), 1L, Long::sum);
            retentionSum += item.estimatedRetention();
        }
        double meanRetention = dueItems.isEmpty() ? 0.0 : retentionSum / dueItems.size();

        return new ReviewQueueStatsDto(
                dueItems.size(),
                returned,
                counts.getOrDefault(CardMaturity.NEW, 0L),
                counts.getOrDefault(CardMaturity.LEARNING, 0L),
                counts.getOrDefault(CardMaturity.YOUNG, 0L),
                counts.getOrDefault(CardMaturity.MATURE, 0L),
                meanRetention
        );
    }

    private int resolveMaxSize(Integer requested) {
        SchedulingProperties.Queue queue = properties.getQueue();
        if (requested == null) {
            return queue.getDefaultMaxSize();
        }
        if (requested < 1 || requested > queue.getMaxSizeLimit()) {
            throw new ValidationException("maxSize must be between 1 and " + queue.getMaxSizeLimit());
        }
        return requested;
    }
}

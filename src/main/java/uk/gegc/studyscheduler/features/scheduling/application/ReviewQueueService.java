package uk.gegc.studyscheduler.features.scheduling.application;

import uk.gegc.studyscheduler.features.scheduling.application.dto.ReviewQueueDto;

import java.time.Instant;
import java.util.UUID;

public interface ReviewQueueService {

    /**
     * Builds the review batch as of the current clock time.
     *
     * @param maxSize batch cap, {@code null} for the configured default
     */
    ReviewQueueDto buildQueue(UUID userId, Integer maxSize);

    ReviewQueueDto buildQueue(UUID userId, Integer maxSize, Instant now);
}

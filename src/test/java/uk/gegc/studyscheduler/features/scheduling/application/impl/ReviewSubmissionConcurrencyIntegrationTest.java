package uk.gegc.studyscheduler.features.scheduling.application.impl;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import uk.gegc.studyscheduler.features.scheduling.application.ReviewSubmissionService;
import uk.gegc.studyscheduler.features.scheduling.application.dto.ReviewOutcome;
import uk.gegc.studyscheduler.features.scheduling.domain.model.FlashcardRef;
import uk.gegc.studyscheduler.features.scheduling.domain.model.ReviewRating;
import uk.gegc.studyscheduler.features.scheduling.domain.model.SchedulingState;
import uk.gegc.studyscheduler.features.scheduling.domain.repository.FlashcardRefRepository;
import uk.gegc.studyscheduler.features.scheduling.domain.repository.SchedulingStateRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs real concurrent submissions against H2. Not transactional: each submission must commit
 * in its own transaction for the version check to matter.
 */
@SpringBootTest
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
@TestPropertySource(properties =
        "spring.datasource.url=jdbc:h2:mem:study_scheduler_concurrency;MODE=MySQL;DB_CLOSE_DELAY=-1;DB_CLOSE_ON_EXIT=FALSE")
@DisplayName("Review submission concurrency")
class ReviewSubmissionConcurrencyIntegrationTest {

    @Autowired
    private ReviewSubmissionService reviewSubmissionService;

    @Autowired
    private SchedulingStateRepository stateRepository;

    @Autowired
    private FlashcardRefRepository flashcardRefRepository;

    private UUID userId;
    private UUID flashcardId;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        userId = UUID.randomUUID();
        flashcardId = UUID.randomUUID();
        flashcardRefRepository.save(new FlashcardRef(flashcardId, userId));
        pool = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
        stateRepository.deleteByFlashcardId(flashcardId);
    }

    private void seedDefaultState() {
        SchedulingState state = new SchedulingState();
        state.setUserId(userId);
        state.setFlashcardId(flashcardId);
        state.setEaseFactor(2.5);
        state.setIntervalDays(0);
        state.setRepetitions(0);
        state.setDueDate(Instant.now());
        state.setTimesReviewed(0);
        state.setTimesCorrect(0);
        stateRepository.saveAndFlush(state);
    }

    private List<ReviewOutcome> submitConcurrently(ReviewRating first, ReviewRating second) throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ReviewOutcome>> futures = new ArrayList<>();
        for (ReviewRating rating : List.of(first, second)) {
            futures.add(pool.submit(() -> {
                start.await();
                return reviewSubmissionService.submitReview(userId, flashcardId, rating);
            }));
        }
        start.countDown();

        List<ReviewOutcome> outcomes = new ArrayList<>();
        for (Future<ReviewOutcome> future : futures) {
            outcomes.add(future.get(30, TimeUnit.SECONDS));
        }
        return outcomes;
    }

    @Test
    @DisplayName("Two simultaneous reviews of an existing state are both applied")
    void concurrentReviews_existingState_noLostUpdate() throws Exception {
        seedDefaultState();

        List<ReviewOutcome> outcomes = submitConcurrently(ReviewRating.GOOD, ReviewRating.GOOD);

        SchedulingState stored = stateRepository.findByUserIdAndFlashcardId(userId, flashcardId).orElseThrow();
        assertThat(stored.getTimesReviewed()).isEqualTo(2);
        assertThat(stored.getTimesCorrect()).isEqualTo(2);
        assertThat(stored.getRepetitions()).isEqualTo(2);
        assertThat(stored.getIntervalDays()).isEqualTo(6);
        assertThat(outcomes).extracting(outcome -> outcome.state().timesReviewed())
                .containsExactlyInAnyOrder(1, 2);
    }

    @Test
    @DisplayName("Two simultaneous first reviews create exactly one state")
    void concurrentReviews_lazyCreation_singleRow() throws Exception {
        List<ReviewOutcome> outcomes = submitConcurrently(ReviewRating.GOOD, ReviewRating.AGAIN);

        SchedulingState stored = stateRepository.findByUserIdAndFlashcardId(userId, flashcardId).orElseThrow();
        assertThat(stored.getTimesReviewed()).isEqualTo(2);
        assertThat(stored.getTimesCorrect()).isEqualTo(1);
        assertThat(outcomes).hasSize(2);
    }
}

package uk.gegc.studyscheduler.features.scheduling.domain.repository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;
import uk.gegc.studyscheduler.features.scheduling.domain.model.CardMaturity;
import uk.gegc.studyscheduler.features.scheduling.domain.model.FlashcardRef;
import uk.gegc.studyscheduler.features.scheduling.domain.model.ReviewLog;
import uk.gegc.studyscheduler.features.scheduling.domain.model.ReviewRating;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@DisplayName("ReviewLogRepository and FlashcardRefRepository Tests")
class ReviewLogRepositoryTest {

    private static final Instant NOW = Instant.parse("2025-09-10T18:00:00Z");

    @Autowired
    private ReviewLogRepository reviewLogRepository;

    @Autowired
    private FlashcardRefRepository flashcardRefRepository;

    @Autowired
    private TestEntityManager entityManager;

    private ReviewLog log(UUID userId, UUID flashcardId, Instant reviewedAt) {
        ReviewLog log = new ReviewLog();
        log.setUserId(userId);
        log.setFlashcardId(flashcardId);
        log.setRating(ReviewRating.GOOD);
        log.setMaturity(CardMaturity.LEARNING);
        log.setIntervalDays(1);
        log.setEaseFactor(2.5);
        log.setRepetitions(1);
        log.setReviewedAt(reviewedAt);
        return log;
    }

    @Test
    @DisplayName("History is returned newest first and only for the requested user")
    void findByUserId_newestFirst() {
        UUID user = UUID.randomUUID();
        UUID flashcard = UUID.randomUUID();
        entityManager.persist(log(user, flashcard, NOW.minus(2, ChronoUnit.DAYS)));
        entityManager.persist(log(user, flashcard, NOW));
        entityManager.persist(log(user, flashcard, NOW.minus(1, ChronoUnit.DAYS)));
        entityManager.persist(log(UUID.randomUUID(), flashcard, NOW));
        entityManager.flush();

        Page<ReviewLog> page = reviewLogRepository.findByUserIdOrderByReviewedAtDesc(user, PageRequest.of(0, 2));

        assertThat(page.getTotalElements()).isEqualTo(3);
        assertThat(page.getContent()).extracting(ReviewLog::getReviewedAt)
                .containsExactly(NOW, NOW.minus(1, ChronoUnit.DAYS));
    }

    @Test
    @DisplayName("Same review recorded twice violates the unique key")
    void save_duplicateReview_rejected() {
        UUID user = UUID.randomUUID();
        UUID flashcard = UUID.randomUUID();
        reviewLogRepository.saveAndFlush(log(user, flashcard, NOW));

        assertThat(reviewLogRepository.existsByUserIdAndFlashcardIdAndReviewedAt(user, flashcard, NOW)).isTrue();
        assertThatThrownBy(() -> reviewLogRepository.saveAndFlush(log(user, flashcard, NOW)))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("deleteByFlashcardId clears the card's history")
    void deleteByFlashcardId_clearsHistory() {
        UUID flashcard = UUID.randomUUID();
        entityManager.persist(log(UUID.randomUUID(), flashcard, NOW));
        entityManager.persist(log(UUID.randomUUID(), flashcard, NOW.minus(1, ChronoUnit.HOURS)));
        entityManager.flush();

        assertThat(reviewLogRepository.deleteByFlashcardId(flashcard)).isEqualTo(2);
    }

    @Test
    @DisplayName("Ownership lookup matches only the owning user")
    void existsByIdAndUserId_matchesOwner() {
        UUID owner = UUID.randomUUID();
        UUID flashcard = UUID.randomUUID();
        entityManager.persistAndFlush(new FlashcardRef(flashcard, owner));

        assertThat(flashcardRefRepository.existsByIdAndUserId(flashcard, owner)).isTrue();
        assertThat(flashcardRefRepository.existsByIdAndUserId(flashcard, UUID.randomUUID())).isFalse();
        assertThat(flashcardRefRepository.existsByIdAndUserId(UUID.randomUUID(), owner)).isFalse();
    }
}

package uk.gegc.studyscheduler.features.scheduling.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Type-safe configuration for the scheduling engine. Every SM-2 policy constant is exposed here
 * so it can be tuned per deployment without code changes; the defaults reproduce the classic
 * again/hard/good/easy behaviour.
 */
@Component
@Data
@Validated
@ConfigurationProperties(prefix = "app.scheduling")
public class SchedulingProperties {

    @Valid
    private Sm2 sm2 = new Sm2();

    @Valid
    private Queue queue = new Queue();

    @Valid
    private Submission submission = new Submission();

    @Valid
    private Goal goal = new Goal();

    @Data
    public static class Sm2 {

        /**
         * Ease factor assigned to a card that has never been reviewed.
         */
        @DecimalMin("1.3")
        private double defaultEaseFactor = 2.5;

        /**
         * Lower bound applied to the ease factor on every update.
         */
        @DecimalMin("1.0")
        private double minEaseFactor = 1.3;

        /**
         * Amount subtracted from the ease factor on a lapse.
         */
        @DecimalMin("0.0")
        private double lapseEasePenalty = 0.20;

        @DecimalMax("0.0")
        private double hardEaseDelta = -0.15;

        @DecimalMin("0.0")
        private double easyEaseDelta = 0.15;

        @DecimalMin("0.1")
        @DecimalMax("1.0")
        private double hardIntervalMultiplier = 0.8;

        @DecimalMin("1.0")
        private double easyIntervalMultiplier = 1.3;

        @Min(1)
        private int firstIntervalDays = 1;

        @Min(1)
        private int secondIntervalDays = 6;

        @Min(1)
        private int lapseIntervalDays = 1;

        /**
         * Ceiling for any computed interval, keeps due dates representable after long easy streaks.
         */
        @Min(1)
        private int maxIntervalDays = 36500;
    }

    @Data
    public static class Queue {

        /**
         * Batch size used when the caller does not ask for one.
         */
        @Min(1)
        private int defaultMaxSize = 50;

        /**
         * Largest batch a caller may request.
         */
        @Min(1)
        private int maxSizeLimit = 200;
    }

    @Data
    public static class Submission {

        @Min(1)
        @Max(10)
        private int maxAttempts = 3;

        /**
         * Linear backoff step between optimistic-lock retries; attempt n waits n times this value.
         */
        @NotNull
        private Duration backoff = Duration.ofMillis(50);
    }

    @Data
    public static class Goal {

        @Min(1)
        private int defaultSecondsPerCard = 10;
    }
}

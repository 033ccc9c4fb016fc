package uk.gegc.studyscheduler.features.scheduling.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;
import uk.gegc.studyscheduler.shared.exception.ValidationException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Self-assessed recall quality for a single review. {@link #AGAIN} is a lapse; the other three
 * are successful recalls of increasing ease.
 */
public enum ReviewRating {
    AGAIN("again"),
    HARD("hard"),
    GOOD("good"),
    EASY("easy");

    private final String value;

    ReviewRating(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isLapse() {
        return this == AGAIN;
    }

    /**
     * Parses an exact wire value. Case variants and surrounding whitespace are rejected.
     *
     * @throws ValidationException if the value is missing or not one of again, hard, good, easy
     */
    public static ReviewRating fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Rating is required");
        }
        for (ReviewRating rating : values()) {
            if (rating.value.equals(raw)) {
                return rating;
            }
        }
        throw new ValidationException("Unknown rating '" + raw + "'. Allowed values: " + allowedValues());
    }

    private static String allowedValues() {
        return Arrays.stream(values()).map(ReviewRating::getValue).collect(Collectors.joining(", "));
    }
}

package uk.gegc.studyscheduler.features.scheduling.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CardMaturity {
    NEW("new"),
    LEARNING("learning"),
    YOUNG("young"),
    MATURE("mature");

    private final String value;

    CardMaturity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

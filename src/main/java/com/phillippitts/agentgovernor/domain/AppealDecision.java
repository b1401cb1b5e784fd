package com.phillippitts.agentgovernor.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of an appeal review.
 */
public enum AppealDecision {
    APPROVED(AppealStatus.APPROVED),
    DENIED(AppealStatus.DENIED);

    private final AppealStatus resultingStatus;

    AppealDecision(AppealStatus resultingStatus) {
        this.resultingStatus = resultingStatus;
    }

    public AppealStatus resultingStatus() {
        return resultingStatus;
    }

    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a decision case-insensitively ("approved", "DENIED", ...).
     *
     * @throws IllegalArgumentException for anything else
     */
    @JsonCreator
    public static AppealDecision from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Appeal decision must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown appeal decision: " + value, e);
        }
    }
}

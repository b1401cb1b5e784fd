package com.phillippitts.agentgovernor.domain;

import java.util.Objects;

/**
 * A detected policy violation.
 *
 * @param type      which policy fired
 * @param value     measured value
 * @param threshold configured threshold the value exceeded
 * @param severity  1 (mild) upwards, derived from how far the value exceeds the threshold
 */
public record Trigger(TriggerType type, double value, double threshold, int severity) {

    public Trigger {
        Objects.requireNonNull(type, "type must not be null");
        if (severity < 1) {
            throw new IllegalArgumentException("Severity must be at least 1, got: " + severity);
        }
    }
}

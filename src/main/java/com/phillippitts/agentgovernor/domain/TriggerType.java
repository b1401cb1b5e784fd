package com.phillippitts.agentgovernor.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Policy violations the evaluator can detect.
 */
public enum TriggerType {
    ERROR_RATE("error_rate", TargetMetric.ERROR_RATE),
    TIMEOUT_FREQUENCY("timeout_frequency", TargetMetric.TIMEOUT_RATE),
    QUALITY_DROP("quality_drop", TargetMetric.QUALITY_SCORE),
    COLLABORATION_FAILURE("collaboration_failure", TargetMetric.COLLABORATION_SUCCESS_RATE),
    RESOURCE_ABUSE("resource_abuse", TargetMetric.RESOURCE_USAGE);

    private final String tag;
    private final TargetMetric recoveryMetric;

    TriggerType(String tag, TargetMetric recoveryMetric) {
        this.tag = tag;
        this.recoveryMetric = recoveryMetric;
    }

    /** Wire tag used in events and penalty records (e.g. {@code error_rate}). */
    @JsonValue
    public String tag() {
        return tag;
    }

    /** Metric an agent must bring back on target to recover from this trigger. */
    public TargetMetric recoveryMetric() {
        return recoveryMetric;
    }
}

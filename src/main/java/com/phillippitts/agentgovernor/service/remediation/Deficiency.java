package com.phillippitts.agentgovernor.service.remediation;

import com.fasterxml.jackson.annotation.JsonValue;
import com.phillippitts.agentgovernor.domain.TriggerType;

/**
 * Skill area a retraining session focuses on, derived from the triggers that caused it.
 */
public enum Deficiency {
    ERROR_HANDLING("error_handling"),
    QUALITY_ASSURANCE("quality_assurance"),
    COLLABORATION("collaboration"),
    RESOURCE_DISCIPLINE("resource_discipline"),
    RESPONSIVENESS("responsiveness");

    private final String tag;

    Deficiency(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public static Deficiency forTrigger(TriggerType type) {
        return switch (type) {
            case ERROR_RATE -> ERROR_HANDLING;
            case QUALITY_DROP -> QUALITY_ASSURANCE;
            case COLLABORATION_FAILURE -> COLLABORATION;
            case RESOURCE_ABUSE -> RESOURCE_DISCIPLINE;
            case TIMEOUT_FREQUENCY -> RESPONSIVENESS;
        };
    }
}

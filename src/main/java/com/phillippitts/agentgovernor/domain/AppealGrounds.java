package com.phillippitts.agentgovernor.domain;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Why an agent contests a penalty.
 *
 * @param type        category, e.g. {@code environmental_factors} or {@code systemic_issue}
 * @param explanation free-form explanation
 * @param evidence    supporting data; entries with a null key or value are dropped
 */
public record AppealGrounds(String type, String explanation, Map<String, Object> evidence) {

    public static final String SYSTEMIC_ISSUE = "systemic_issue";

    public AppealGrounds {
        Objects.requireNonNull(type, "Grounds type must not be null");
        explanation = explanation == null ? "" : explanation;
        evidence = evidence == null ? Map.of() : Map.copyOf(withoutNulls(evidence));
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> evidence) {
        Map<String, Object> kept = new LinkedHashMap<>();
        evidence.forEach((key, value) -> {
            if (key != null && value != null) {
                kept.put(key, value);
            }
        });
        return kept;
    }
}

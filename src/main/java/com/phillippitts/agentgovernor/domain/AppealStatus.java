package com.phillippitts.agentgovernor.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AppealStatus {
    NONE, PENDING, APPROVED, DENIED;

    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package com.verolang.core.error;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether a failure is expected to reproduce on every attempt.
 */
public enum Flakiness {
    PERMANENT("permanent"),
    FLAKY("flaky"),
    UNKNOWN("unknown");

    private final String id;

    Flakiness(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }
}

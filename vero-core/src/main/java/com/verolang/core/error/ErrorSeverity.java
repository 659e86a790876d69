package com.verolang.core.error;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of a diagnostic. Only {@link #ERROR} affects validity.
 */
public enum ErrorSeverity {
    ERROR("error"),
    WARNING("warning"),
    INFO("info"),
    HINT("hint");

    private final String id;

    ErrorSeverity(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }
}

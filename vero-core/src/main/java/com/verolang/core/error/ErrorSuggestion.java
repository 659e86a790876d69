package com.verolang.core.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * A hint attached to a {@link VeroError}.
 *
 * @param text human-readable suggestion
 * @param action kind of follow-up, or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorSuggestion(String text, Action action) {

    public ErrorSuggestion {
        Objects.requireNonNull(text, "text must not be null");
    }

    public static ErrorSuggestion fix(String text) {
        return new ErrorSuggestion(text, Action.FIX);
    }

    public static ErrorSuggestion retry(String text) {
        return new ErrorSuggestion(text, Action.RETRY);
    }

    public static ErrorSuggestion investigate(String text) {
        return new ErrorSuggestion(text, Action.INVESTIGATE);
    }

    public enum Action {
        FIX("fix"),
        RETRY("retry"),
        INVESTIGATE("investigate");

        private final String id;

        Action(String id) {
            this.id = id;
        }

        @JsonValue
        public String id() {
            return id;
        }
    }
}

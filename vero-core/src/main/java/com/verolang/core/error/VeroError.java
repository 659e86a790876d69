package com.verolang.core.error;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The single diagnostic shape shared by the compiler and the execution layer.
 *
 * <p>Lexer, parser and validator report {@code VeroError} values instead of throwing. Execution
 * failures use the same record, so one reporting surface renders both. Instances are built
 * through the category factories ({@link LexerErrors}, {@link ParserErrors},
 * {@link ValidationErrors}, {@link LocatorErrors}, ...) or {@link #builder(ErrorCode)}.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * VeroError error = VeroError.builder(ErrorCode.PAGE_NOT_IMPORTED)
 *     .location(ErrorLocation.atLine(12))
 *     .whatWentWrong("Page 'Checkout' is not in the USE list.")
 *     .howToFix("Add 'USE Checkout' to the feature.")
 *     .build();
 *
 * error.toShortMessage(); // [VERO-201] Page Not Imported: Page 'Checkout' is not ... (line 12)
 * }</pre>
 *
 * @param code registry code such as {@code VERO-201}
 * @param category origin of the error
 * @param severity severity; only errors affect validity
 * @param location source position, or null for errors without one
 * @param title short title
 * @param whatWentWrong plain-language description for non-programmers
 * @param howToFix plain-language remedy
 * @param technicalMessage raw message for developers, or null
 * @param flakiness whether the failure reproduces on every attempt
 * @param retryable whether a runner may retry
 * @param suggestedRetries retry budget hint
 * @param suggestions follow-up hints
 * @param veroStatement source statement text, or null
 * @param selector selector involved, or null
 * @param expectedValue expected value for assertion failures, or null
 * @param actualValue actual value for assertion failures, or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VeroError(
    String code,
    ErrorCategory category,
    ErrorSeverity severity,
    ErrorLocation location,
    String title,
    String whatWentWrong,
    String howToFix,
    String technicalMessage,
    Flakiness flakiness,
    boolean retryable,
    int suggestedRetries,
    List<ErrorSuggestion> suggestions,
    String veroStatement,
    String selector,
    String expectedValue,
    String actualValue
) {
    public VeroError {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(whatWentWrong, "whatWentWrong must not be null");
        if (howToFix == null) {
            howToFix = "";
        }
        if (flakiness == null) {
            flakiness = Flakiness.UNKNOWN;
        }
        if (category.isCompileTime()) {
            flakiness = Flakiness.PERMANENT;
            retryable = false;
            suggestedRetries = 0;
        }
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    /**
     * Starts a builder pre-filled with the registry defaults of {@code code}.
     *
     * @param code registry entry
     * @return new builder
     */
    public static Builder builder(ErrorCode code) {
        return new Builder(code);
    }

    /**
     * Line of the error, or 0 when it has no location.
     */
    @JsonIgnore
    public int line() {
        return location == null ? 0 : location.line();
    }

    @JsonIgnore
    public boolean isError() {
        return severity == ErrorSeverity.ERROR;
    }

    @JsonIgnore
    public boolean isCompileTime() {
        return category.isCompileTime();
    }

    /**
     * Whether a runner should try again after {@code attempt} failed attempts.
     *
     * @param attempt number of attempts already made, starting at 1
     * @return true while the retry budget is not exhausted
     */
    public boolean shouldRetry(int attempt) {
        return retryable && attempt <= suggestedRetries;
    }

    /**
     * One-line form: {@code [VERO-201] Page Not Imported: what went wrong (line 3)}.
     */
    public String toShortMessage() {
        StringBuilder sb = new StringBuilder()
            .append('[').append(code).append("] ")
            .append(title).append(": ")
            .append(whatWentWrong);
        if (location != null) {
            sb.append(" (line ").append(location.line()).append(')');
        }
        return sb.toString();
    }

    /**
     * Multi-line form meant for end users.
     */
    public String toDisplayMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(severity.id().toUpperCase()).append(' ').append(code).append(": ").append(title);
        if (location != null) {
            sb.append(" (line ").append(location.line()).append(", column ").append(location.column()).append(')');
        }
        sb.append(System.lineSeparator());
        if (veroStatement != null) {
            sb.append("  Statement: ").append(veroStatement).append(System.lineSeparator());
        }
        sb.append("  What went wrong: ").append(whatWentWrong).append(System.lineSeparator());
        if (expectedValue != null || actualValue != null) {
            sb.append("  Expected: ").append(Objects.toString(expectedValue, "-"))
                .append(", actual: ").append(Objects.toString(actualValue, "-"))
                .append(System.lineSeparator());
        }
        if (!howToFix.isEmpty()) {
            sb.append("  How to fix: ").append(howToFix).append(System.lineSeparator());
        }
        for (ErrorSuggestion suggestion : suggestions) {
            sb.append("  - ").append(suggestion.text()).append(System.lineSeparator());
        }
        return sb.toString().stripTrailing();
    }

    /**
     * Fluent builder. Defaults come from the {@link ErrorCode} the builder was created with.
     */
    public static final class Builder {
        private final ErrorCode code;
        private ErrorSeverity severity;
        private ErrorLocation location;
        private String title;
        private String whatWentWrong;
        private String howToFix;
        private String technicalMessage;
        private Flakiness flakiness;
        private boolean retryable;
        private int suggestedRetries;
        private final List<ErrorSuggestion> suggestions = new ArrayList<>();
        private String veroStatement;
        private String selector;
        private String expectedValue;
        private String actualValue;

        private Builder(ErrorCode code) {
            this.code = Objects.requireNonNull(code, "code must not be null");
            this.severity = code.defaultSeverity();
            this.title = code.title();
            this.whatWentWrong = code.description();
            this.flakiness = code.flakiness();
            this.retryable = code.retryable();
            this.suggestedRetries = code.suggestedRetries();
        }

        public Builder severity(ErrorSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder location(ErrorLocation location) {
            this.location = location;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder whatWentWrong(String whatWentWrong) {
            this.whatWentWrong = whatWentWrong;
            return this;
        }

        public Builder howToFix(String howToFix) {
            this.howToFix = howToFix;
            return this;
        }

        public Builder technicalMessage(String technicalMessage) {
            this.technicalMessage = technicalMessage;
            return this;
        }

        public Builder flakiness(Flakiness flakiness) {
            this.flakiness = flakiness;
            return this;
        }

        public Builder retryable(boolean retryable) {
            this.retryable = retryable;
            return this;
        }

        public Builder suggestedRetries(int suggestedRetries) {
            this.suggestedRetries = suggestedRetries;
            return this;
        }

        public Builder suggestion(ErrorSuggestion suggestion) {
            this.suggestions.add(suggestion);
            return this;
        }

        public Builder suggestions(List<ErrorSuggestion> suggestions) {
            this.suggestions.addAll(suggestions);
            return this;
        }

        public Builder veroStatement(String veroStatement) {
            this.veroStatement = veroStatement;
            return this;
        }

        public Builder selector(String selector) {
            this.selector = selector;
            return this;
        }

        public Builder expectedValue(String expectedValue) {
            this.expectedValue = expectedValue;
            return this;
        }

        public Builder actualValue(String actualValue) {
            this.actualValue = actualValue;
            return this;
        }

        public VeroError build() {
            return new VeroError(code.code(), code.category(), severity, location, title, whatWentWrong,
                howToFix, technicalMessage, flakiness, retryable, suggestedRetries, suggestions,
                veroStatement, selector, expectedValue, actualValue);
        }
    }
}

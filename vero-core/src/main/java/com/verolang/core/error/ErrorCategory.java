package com.verolang.core.error;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Origin of a {@link VeroError}.
 *
 * <p>The first three categories are produced by the compiler pipeline. The rest describe
 * failures observed while a generated script runs.
 */
public enum ErrorCategory {
    LEXER("lexer", true),
    PARSER("parser", true),
    VALIDATION("validation", true),
    LOCATOR("locator", false),
    TIMEOUT("timeout", false),
    NAVIGATION("navigation", false),
    ASSERTION("assertion", false),
    BROWSER("browser", false),
    NETWORK("network", false);

    private final String id;
    private final boolean compileTime;

    ErrorCategory(String id, boolean compileTime) {
        this.id = id;
        this.compileTime = compileTime;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public boolean isCompileTime() {
        return compileTime;
    }

    /**
     * Looks up a category by its lowercase identifier.
     *
     * @param id identifier such as {@code "locator"}
     * @return matching category
     * @throws IllegalArgumentException if no category has that identifier
     */
    public static ErrorCategory fromId(String id) {
        for (ErrorCategory category : values()) {
            if (category.id.equalsIgnoreCase(id)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown error category: " + id);
    }
}

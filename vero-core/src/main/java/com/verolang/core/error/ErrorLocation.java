package com.verolang.core.error;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Source position of a diagnostic. Lines and columns are 1-based.
 *
 * @param line start line
 * @param column start column
 * @param endLine end line, or null when unknown
 * @param endColumn end column, or null when unknown
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorLocation(
    int line,
    int column,
    Integer endLine,
    Integer endColumn
) {
    public ErrorLocation {
        if (line < 1) {
            throw new IllegalArgumentException("line must be >= 1 but was " + line);
        }
        if (column < 1) {
            throw new IllegalArgumentException("column must be >= 1 but was " + column);
        }
    }

    public static ErrorLocation at(int line, int column) {
        return new ErrorLocation(line, column, null, null);
    }

    /**
     * Location for nodes that only track their line.
     */
    public static ErrorLocation atLine(int line) {
        return new ErrorLocation(Math.max(line, 1), 1, null, null);
    }
}

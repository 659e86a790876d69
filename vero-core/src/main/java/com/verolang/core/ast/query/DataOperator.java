package com.verolang.core.ast.query;

/**
 * Operators of a single WHERE comparison.
 */
public enum DataOperator {
    EQUAL,
    NOT_EQUAL,
    GREATER,
    LESS,
    GREATER_OR_EQUAL,
    LESS_OR_EQUAL,
    CONTAINS,
    STARTS_WITH,
    ENDS_WITH,
    MATCHES,
    IN,
    NOT_IN,
    IS_EMPTY,
    IS_NOT_EMPTY,
    IS_NULL,
    IS_NOT_NULL;

    /**
     * Whether the operator takes no right-hand value.
     */
    public boolean isUnary() {
        return this == IS_EMPTY || this == IS_NOT_EMPTY || this == IS_NULL || this == IS_NOT_NULL;
    }

    public boolean isList() {
        return this == IN || this == NOT_IN;
    }
}

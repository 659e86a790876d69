package com.verolang.core.ast.query;

/**
 * What a data query produces.
 */
public enum ResultType {
    /** One row. */
    DATA,
    /** Several rows or values. */
    LIST,
    /** An aggregate number. */
    NUMBER,
    /** A single column value. */
    TEXT
}

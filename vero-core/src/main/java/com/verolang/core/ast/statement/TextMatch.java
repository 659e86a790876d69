package com.verolang.core.ast.statement;

/**
 * How an expected text is compared with the actual one.
 */
public enum TextMatch {
    CONTAINS,
    EQUALS,
    MATCHES
}

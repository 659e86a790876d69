package com.verolang.core.ast.query;

public enum RowPosition {
    FIRST,
    LAST,
    RANDOM
}

package com.verolang.core.ast.query;

/**
 * Aggregate functions. Every function except {@link #COUNT} needs a column.
 */
public enum Aggregation {
    COUNT(ResultType.NUMBER),
    SUM(ResultType.NUMBER),
    AVERAGE(ResultType.NUMBER),
    MIN(ResultType.NUMBER),
    MAX(ResultType.NUMBER),
    DISTINCT(ResultType.LIST);

    private final ResultType resultType;

    Aggregation(ResultType resultType) {
        this.resultType = resultType;
    }

    public ResultType resultType() {
        return resultType;
    }

    public boolean requiresColumn() {
        return this != COUNT;
    }
}

package com.verolang.core.ast.query;

import java.util.List;
import java.util.Objects;

/**
 * A query over a test data table.
 *
 * @param table source table
 * @param position row pick for single-row queries, or null
 * @param column projected column, or null for whole rows
 * @param where filter, or null
 * @param orderBy sort keys, applied in order
 * @param limit maximum number of rows, or null
 * @param offset rows to skip, or null
 * @param aggregation aggregate function, or null
 */
public record DataQuery(
    TableRef table,
    RowPosition position,
    String column,
    DataCondition where,
    List<OrderBy> orderBy,
    Integer limit,
    Integer offset,
    Aggregation aggregation
) {
    public DataQuery {
        Objects.requireNonNull(table, "table must not be null");
        orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
        if (aggregation != null && aggregation.requiresColumn() && column == null) {
            throw new IllegalArgumentException(aggregation + " requires a column");
        }
    }
}

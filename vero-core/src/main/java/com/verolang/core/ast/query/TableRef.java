package com.verolang.core.ast.query;

import java.util.Objects;

/**
 * {@code Users} or {@code ProjectB.Users}.
 */
public record TableRef(String project, String table) {

    public TableRef {
        Objects.requireNonNull(table, "table must not be null");
    }

    public static TableRef of(String table) {
        return new TableRef(null, table);
    }

    /**
     * Key under which the table is found in the test data set.
     */
    public String qualifiedName() {
        return project == null ? table : project + "." + table;
    }
}

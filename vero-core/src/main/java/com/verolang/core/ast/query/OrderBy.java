package com.verolang.core.ast.query;

import java.util.Objects;

public record OrderBy(String column, boolean descending) {

    public OrderBy {
        Objects.requireNonNull(column, "column must not be null");
    }
}

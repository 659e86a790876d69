package com.verolang.core.ast.statement;

import com.verolang.core.ast.query.DataCondition;
import com.verolang.core.ast.query.TableRef;

import java.util.Objects;

/**
 * {@code LOAD users FROM "Users" [WHERE condition]} binds every matching row.
 */
public record LoadStatement(String variable, TableRef table, DataCondition where, int line) implements Statement {

    public LoadStatement {
        Objects.requireNonNull(variable, "variable must not be null");
        Objects.requireNonNull(table, "table must not be null");
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitLoadStatement(this);
    }
}

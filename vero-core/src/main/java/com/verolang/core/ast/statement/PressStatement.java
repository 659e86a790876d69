package com.verolang.core.ast.statement;

import com.verolang.core.ast.Expression;

import java.util.Objects;

/**
 * {@code PRESS "Enter"}.
 */
public record PressStatement(Expression key, int line) implements Statement {

    public PressStatement {
        Objects.requireNonNull(key, "key must not be null");
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitPressStatement(this);
    }
}

package com.verolang.core.ast.statement;

import com.verolang.core.ast.Target;

import java.util.Objects;

/**
 * {@code CLEAR target} empties an input.
 */
public record ClearStatement(Target target, int line) implements Statement {

    public ClearStatement {
        Objects.requireNonNull(target, "target must not be null");
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitClearStatement(this);
    }
}

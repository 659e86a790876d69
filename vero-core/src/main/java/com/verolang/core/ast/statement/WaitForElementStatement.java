package com.verolang.core.ast.statement;

import com.verolang.core.ast.Target;

import java.util.Objects;

/**
 * {@code WAIT FOR target}.
 */
public record WaitForElementStatement(Target target, int line) implements Statement {

    public WaitForElementStatement {
        Objects.requireNonNull(target, "target must not be null");
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitWaitForElementStatement(this);
    }
}

package com.verolang.core.ast.statement;

import com.verolang.core.ast.Target;

import java.util.Objects;

/**
 * {@code CHECK target} ({@code checked = true}) or {@code UNCHECK target}.
 */
public record CheckStatement(Target target, boolean checked, int line) implements Statement {

    public CheckStatement {
        Objects.requireNonNull(target, "target must not be null");
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitCheckStatement(this);
    }
}

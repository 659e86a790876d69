package com.verolang.core.ast.statement;

import com.verolang.core.ast.Expression;
import com.verolang.core.ast.Target;

import java.util.Objects;

/**
 * {@code FILL target WITH value}.
 */
public record FillStatement(Target target, Expression value, int line) implements Statement {

    public FillStatement {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitFillStatement(this);
    }
}

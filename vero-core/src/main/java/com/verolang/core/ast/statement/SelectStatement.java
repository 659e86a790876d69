package com.verolang.core.ast.statement;

import com.verolang.core.ast.Expression;
import com.verolang.core.ast.Target;

import java.util.Objects;

/**
 * {@code SELECT option FROM target}.
 */
public record SelectStatement(Expression option, Target target, int line) implements Statement {

    public SelectStatement {
        Objects.requireNonNull(option, "option must not be null");
        Objects.requireNonNull(target, "target must not be null");
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitSelectStatement(this);
    }
}

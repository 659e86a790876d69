package com.verolang.core.ast.statement;

import com.verolang.core.ast.Expression;

import java.util.Objects;

/**
 * {@code WAIT FOR URL CONTAINS "/dashboard"}.
 */
public record WaitForUrlStatement(TextMatch match, Expression value, int line) implements Statement {

    public WaitForUrlStatement {
        Objects.requireNonNull(match, "match must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitWaitForUrlStatement(this);
    }
}

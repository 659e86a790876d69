package com.verolang.core.ast.statement;

import com.verolang.core.ast.Expression;
import com.verolang.core.ast.Target;

import java.util.Objects;

/**
 * {@code RETURN}, {@code RETURN expr} or {@code RETURN VISIBLE|TEXT|VALUE OF target}.
 */
public record ReturnStatement(Kind kind, Target target, Expression value, int line) implements Statement {

    public ReturnStatement {
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public enum Kind {
        /** Bare {@code RETURN}. */
        NOTHING,
        EXPRESSION,
        VISIBLE_OF,
        TEXT_OF,
        VALUE_OF
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitReturnStatement(this);
    }
}

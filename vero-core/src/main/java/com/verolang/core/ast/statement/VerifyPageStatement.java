package com.verolang.core.ast.statement;

import com.verolang.core.ast.Expression;

import java.util.Objects;

/**
 * {@code VERIFY URL CONTAINS "/home"}, {@code VERIFY TITLE EQUALS "Home"}.
 */
public record VerifyPageStatement(Subject subject, TextMatch match, Expression value, int line) implements Statement {

    public VerifyPageStatement {
        Objects.requireNonNull(subject, "subject must not be null");
        Objects.requireNonNull(match, "match must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    public enum Subject {
        URL,
        TITLE
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitVerifyPageStatement(this);
    }
}

package com.verolang.core.ast.statement;

import com.verolang.core.ast.Expression;

import java.util.Objects;

public record LogStatement(Expression message, int line) implements Statement {

    public LogStatement {
        Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitLogStatement(this);
    }
}

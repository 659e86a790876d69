package com.verolang.core.ast.statement;

import com.verolang.core.ast.Expression;

import java.util.List;
import java.util.Objects;

/**
 * {@code REPEAT 3 TIMES { ... }}.
 */
public record RepeatStatement(Expression count, List<Statement> statements, int line) implements Statement {

    public RepeatStatement {
        Objects.requireNonNull(count, "count must not be null");
        statements = statements == null ? List.of() : List.copyOf(statements);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitRepeatStatement(this);
    }
}

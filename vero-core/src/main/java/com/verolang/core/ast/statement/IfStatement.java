package com.verolang.core.ast.statement;

import com.verolang.core.ast.Condition;

import java.util.List;
import java.util.Objects;

/**
 * {@code IF condition { ... } ELSE { ... }}. {@code ELSE IF} is stored as a nested {@code IfStatement}.
 */
public record IfStatement(Condition condition, List<Statement> thenStatements, List<Statement> elseStatements, int line) implements Statement {

    public IfStatement {
        Objects.requireNonNull(condition, "condition must not be null");
        thenStatements = thenStatements == null ? List.of() : List.copyOf(thenStatements);
        elseStatements = elseStatements == null ? List.of() : List.copyOf(elseStatements);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitIfStatement(this);
    }
}

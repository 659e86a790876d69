package com.verolang.core.ast.statement;

import java.util.List;
import java.util.Objects;

/**
 * {@code FOR EACH item IN collection { ... }}.
 */
public record ForEachStatement(String item, String collection, List<Statement> statements, int line) implements Statement {

    public ForEachStatement {
        Objects.requireNonNull(item, "item must not be null");
        Objects.requireNonNull(collection, "collection must not be null");
        statements = statements == null ? List.of() : List.copyOf(statements);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitForEachStatement(this);
    }
}

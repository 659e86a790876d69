package com.verolang.core.ast.statement;

import com.verolang.core.ast.Expression;

import java.util.Objects;

/**
 * {@code OPEN url [IN NEW TAB]}.
 */
public record OpenStatement(Expression url, boolean newTab, int line) implements Statement {

    public OpenStatement {
        Objects.requireNonNull(url, "url must not be null");
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitOpenStatement(this);
    }
}

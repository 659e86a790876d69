package com.verolang.core.ast.statement;

public record RefreshStatement(int line) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitRefreshStatement(this);
    }
}

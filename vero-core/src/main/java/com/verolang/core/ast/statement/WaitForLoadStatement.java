package com.verolang.core.ast.statement;

import java.util.Objects;

/**
 * {@code WAIT FOR NAVIGATION}, {@code WAIT FOR NETWORK IDLE} or a bare {@code WAIT}.
 */
public record WaitForLoadStatement(LoadState state, int line) implements Statement {

    public WaitForLoadStatement {
        Objects.requireNonNull(state, "state must not be null");
    }

    public enum LoadState {
        NAVIGATION,
        NETWORK_IDLE
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitWaitForLoadStatement(this);
    }
}

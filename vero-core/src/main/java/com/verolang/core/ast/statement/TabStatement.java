package com.verolang.core.ast.statement;

import com.verolang.core.ast.Expression;

import java.util.Objects;

/**
 * Tab control.
 */
public record TabStatement(Action action, Expression argument, int line) implements Statement {

    public TabStatement {
        Objects.requireNonNull(action, "action must not be null");
        if (action == Action.SWITCH_TO && argument == null) {
            throw new IllegalArgumentException("SWITCH TO TAB needs a tab number");
        }
    }

    public enum Action {
        /** Opens a new tab, optionally navigating to {@code argument}. */
        SWITCH_TO_NEW,
        /** Switches to the 1-based tab {@code argument}. */
        SWITCH_TO,
        CLOSE
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitTabStatement(this);
    }
}

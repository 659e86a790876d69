package com.verolang.core.ast.statement;

import com.verolang.core.ast.Expression;

/**
 * {@code ACCEPT DIALOG [WITH text]} or {@code DISMISS DIALOG}. Registers a handler for the next dialog.
 */
public record DialogStatement(boolean accept, Expression response, int line) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitDialogStatement(this);
    }
}

package com.verolang.core.ast.statement;

import com.verolang.core.ast.Selector;

/**
 * {@code SWITCH TO FRAME selector}, or {@code SWITCH TO MAIN FRAME} when {@code frame} is null.
 */
public record FrameStatement(Selector frame, int line) implements Statement {

    public boolean isMainFrame() {
        return frame == null;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitFrameStatement(this);
    }
}

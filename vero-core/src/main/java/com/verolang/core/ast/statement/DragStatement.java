package com.verolang.core.ast.statement;

import com.verolang.core.ast.Target;

import java.util.Objects;

/**
 * {@code DRAG source TO destination} or {@code DRAG source TO 100, 200}.
 */
public record DragStatement(Target source, Target destination, Integer x, Integer y, int line) implements Statement {

    public DragStatement {
        Objects.requireNonNull(source, "source must not be null");
        if (destination == null && (x == null || y == null)) {
            throw new IllegalArgumentException("Drag needs a destination or coordinates");
        }
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitDragStatement(this);
    }
}

package com.verolang.core.ast.statement;

import com.verolang.core.ast.Target;

/**
 * {@code SCROLL DOWN} or {@code SCROLL TO target}. Exactly one of {@code direction} and
 * {@code target} is set.
 */
public record ScrollStatement(Direction direction, Target target, int line) implements Statement {

    public ScrollStatement {
        if ((direction == null) == (target == null)) {
            throw new IllegalArgumentException("Scroll needs either a direction or a target");
        }
    }

    public enum Direction {
        UP,
        DOWN,
        LEFT,
        RIGHT
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitScrollStatement(this);
    }
}

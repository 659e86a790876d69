package com.verolang.core.ast.statement;

import com.verolang.core.ast.Target;

import java.util.Objects;

/**
 * {@code CLICK target}, {@code DOUBLE CLICK target}, {@code RIGHT CLICK target}, {@code FORCE CLICK target}.
 */
public record ClickStatement(Target target, ClickType clickType, int line) implements Statement {

    public ClickStatement {
        Objects.requireNonNull(target, "target must not be null");
        if (clickType == null) {
            clickType = ClickType.SINGLE;
        }
    }

    public enum ClickType {
        SINGLE,
        DOUBLE,
        RIGHT,
        FORCE
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitClickStatement(this);
    }
}

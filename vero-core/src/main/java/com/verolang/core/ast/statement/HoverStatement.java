package com.verolang.core.ast.statement;

import com.verolang.core.ast.Target;

import java.util.Objects;

public record HoverStatement(Target target, int line) implements Statement {

    public HoverStatement {
        Objects.requireNonNull(target, "target must not be null");
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitHoverStatement(this);
    }
}

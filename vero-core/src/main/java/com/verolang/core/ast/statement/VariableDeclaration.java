package com.verolang.core.ast.statement;

import com.verolang.core.ast.Expression;
import com.verolang.core.ast.VarType;

import java.util.Objects;

/**
 * {@code TEXT name = expression} inside a scenario or action body.
 */
public record VariableDeclaration(VarType type, String name, Expression value, int line) implements Statement {

    public VariableDeclaration {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitVariableDeclaration(this);
    }
}

package com.verolang.core.ast.statement;

import com.verolang.core.ast.Expression;
import com.verolang.core.ast.VariableReference;

import java.util.Objects;

/**
 * Assertion on a variable: {@code VERIFY loggedIn IS TRUE}, {@code VERIFY total EQUALS 3}.
 */
public record VerifyVariableStatement(VariableReference variable, boolean negated, Kind kind, Expression value, int line) implements Statement {

    public VerifyVariableStatement {
        Objects.requireNonNull(variable, "variable must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == Kind.EQUALS && value == null) {
            throw new IllegalArgumentException(kind + " needs a value");
        }
    }

    public enum Kind {
        IS_TRUE,
        IS_FALSE,
        EQUALS
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitVerifyVariableStatement(this);
    }
}

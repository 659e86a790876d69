package com.verolang.core.ast.statement;

import com.verolang.core.ast.ActionCall;
import com.verolang.core.ast.VarType;

import java.util.Objects;

/**
 * {@code PERFORM Page.action WITH args}, optionally assigning the result:
 * {@code FLAG ok = PERFORM Page.isLoggedIn}.
 */
public record PerformStatement(ActionCall call, VarType resultType, String resultVariable, int line) implements Statement {

    public PerformStatement {
        Objects.requireNonNull(call, "call must not be null");
    }

    public boolean assignsResult() {
        return resultVariable != null;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitPerformStatement(this);
    }
}

package com.verolang.core.ast.statement;

import com.verolang.core.ast.Expression;

import java.util.Objects;

/**
 * {@code SET COOKIE name TO value} or {@code CLEAR COOKIES}.
 */
public record CookieStatement(Action action, Expression name, Expression value, int line) implements Statement {

    public CookieStatement {
        Objects.requireNonNull(action, "action must not be null");
        if (action == Action.SET && (name == null || value == null)) {
            throw new IllegalArgumentException("SET COOKIE needs a name and a value");
        }
    }

    public enum Action {
        SET,
        CLEAR
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitCookieStatement(this);
    }
}

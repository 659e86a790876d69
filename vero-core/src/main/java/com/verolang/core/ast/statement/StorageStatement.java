package com.verolang.core.ast.statement;

import com.verolang.core.ast.Expression;

import java.util.Objects;

/**
 * Local storage access: {@code SET STORAGE k TO v}, {@code GET STORAGE k AS var}, {@code CLEAR STORAGE}.
 */
public record StorageStatement(Action action, Expression key, Expression value, String variable, int line) implements Statement {

    public StorageStatement {
        Objects.requireNonNull(action, "action must not be null");
        if (action == Action.SET && (key == null || value == null)) {
            throw new IllegalArgumentException("SET STORAGE needs a key and a value");
        }
        if (action == Action.GET && (key == null || variable == null)) {
            throw new IllegalArgumentException("GET STORAGE needs a key and a variable");
        }
    }

    public enum Action {
        SET,
        GET,
        CLEAR
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitStorageStatement(this);
    }
}

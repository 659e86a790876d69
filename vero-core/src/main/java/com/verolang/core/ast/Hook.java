package com.verolang.core.ast;

import com.verolang.core.ast.statement.Statement;

import java.util.List;
import java.util.Objects;

/**
 * {@code BEFORE EACH { ... }} and friends.
 */
public record Hook(Type type, List<Statement> statements, int line) {

    public Hook {
        Objects.requireNonNull(type, "type must not be null");
        statements = statements == null ? List.of() : List.copyOf(statements);
    }

    public enum Type {
        BEFORE_ALL,
        BEFORE_EACH,
        AFTER_ALL,
        AFTER_EACH;

        /**
         * Whether the hook runs once per feature rather than once per test.
         */
        public boolean isOnce() {
            return this == BEFORE_ALL || this == AFTER_ALL;
        }
    }
}

package com.verolang.core.ast;

import java.util.Objects;

/**
 * Page variable: {@code TEXT greeting = "Hello"}.
 */
public record Variable(VarType type, String name, Expression value, int line) {

    public Variable {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }
}

package com.verolang.core.ast;

import java.util.Objects;

public record StringLiteral(String value) implements Expression {

    public StringLiteral {
        Objects.requireNonNull(value, "value must not be null");
    }
}

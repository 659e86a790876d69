package com.verolang.core.ast;

import java.util.Objects;

/**
 * Numeric literal. {@code text} keeps the source spelling so generated code reads like the input.
 */
public record NumberLiteral(double value, String text) implements Expression {

    public NumberLiteral {
        Objects.requireNonNull(text, "text must not be null");
    }

    public static NumberLiteral of(String text) {
        return new NumberLiteral(Double.parseDouble(text), text);
    }
}

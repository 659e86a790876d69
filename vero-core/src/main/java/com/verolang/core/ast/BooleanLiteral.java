package com.verolang.core.ast;

public record BooleanLiteral(boolean value) implements Expression {
}

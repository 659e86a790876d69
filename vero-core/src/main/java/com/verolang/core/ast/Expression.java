package com.verolang.core.ast;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Value-producing expression.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "@type")
public sealed interface Expression
    permits StringLiteral, NumberLiteral, BooleanLiteral, VariableReference, EnvVarReference {
}

package com.verolang.core.ast.statement;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A step inside a scenario, hook or action body.
 *
 * <p>Every statement carries its source line for diagnostics. Consumers walk statements with a
 * {@link StatementVisitor}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "@type")
public interface Statement {

    int line();

    <R> R accept(StatementVisitor<R> visitor);
}

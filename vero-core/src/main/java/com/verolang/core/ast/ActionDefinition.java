package com.verolang.core.ast;

import com.verolang.core.ast.statement.Statement;

import java.util.List;
import java.util.Objects;

/**
 * Reusable action on a page or page actions library.
 *
 * @param name action name
 * @param parameters parameter names, bound positionally by {@code PERFORM ... WITH}
 * @param returnType declared return type, or null
 * @param statements body
 * @param line declaration line
 */
public record ActionDefinition(
    String name,
    List<String> parameters,
    VarType returnType,
    List<Statement> statements,
    int line
) {
    public ActionDefinition {
        Objects.requireNonNull(name, "name must not be null");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        statements = statements == null ? List.of() : List.copyOf(statements);
    }
}

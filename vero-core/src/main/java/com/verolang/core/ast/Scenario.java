package com.verolang.core.ast;

import com.verolang.core.ast.statement.Statement;

import java.util.List;
import java.util.Objects;

/**
 * A test case.
 *
 * @param name scenario name, either a quoted string or an identifier such as {@code SuccessfulLogin}
 * @param tags tags written after the name, without the leading {@code @}
 * @param statements body
 * @param line declaration line
 */
public record Scenario(String name, List<String> tags, List<Statement> statements, int line) {

    public Scenario {
        Objects.requireNonNull(name, "name must not be null");
        tags = tags == null ? List.of() : List.copyOf(tags);
        statements = statements == null ? List.of() : List.copyOf(statements);
    }
}

package com.verolang.core.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A screen or component: named selectors (fields), variables and reusable actions.
 *
 * @param name page name, PascalCase by convention
 * @param fields selector aliases
 * @param variables page-level constants
 * @param actions reusable step sequences
 * @param line declaration line
 */
public record Page(
    String name,
    List<Field> fields,
    List<Variable> variables,
    List<ActionDefinition> actions,
    int line
) {
    public Page {
        Objects.requireNonNull(name, "name must not be null");
        fields = fields == null ? List.of() : List.copyOf(fields);
        variables = variables == null ? List.of() : List.copyOf(variables);
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    public Optional<Field> findField(String fieldName) {
        return fields.stream().filter(field -> field.name().equals(fieldName)).findFirst();
    }

    public Optional<Variable> findVariable(String variableName) {
        return variables.stream().filter(variable -> variable.name().equals(variableName)).findFirst();
    }

    public Optional<ActionDefinition> findAction(String actionName) {
        return actions.stream().filter(action -> action.name().equals(actionName)).findFirst();
    }
}

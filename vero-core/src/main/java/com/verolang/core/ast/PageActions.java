package com.verolang.core.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A library of reusable actions, optionally bound to one page with {@code FOR}.
 *
 * @param name library name
 * @param forPage page the actions operate on, or null
 * @param actions action definitions
 * @param line declaration line
 */
public record PageActions(
    String name,
    String forPage,
    List<ActionDefinition> actions,
    int line
) {
    public PageActions {
        Objects.requireNonNull(name, "name must not be null");
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    public Optional<ActionDefinition> findAction(String actionName) {
        return actions.stream().filter(action -> action.name().equals(actionName)).findFirst();
    }
}

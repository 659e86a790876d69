package com.verolang.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * A test suite.
 *
 * @param name feature name
 * @param annotations lowercase annotations written before {@code FEATURE}, e.g. {@code serial}
 * @param uses pages and libraries the feature depends on
 * @param hooks setup and teardown blocks
 * @param scenarios test cases in source order
 * @param line declaration line
 */
public record Feature(
    String name,
    List<String> annotations,
    List<UseRef> uses,
    List<Hook> hooks,
    List<Scenario> scenarios,
    int line
) {
    public Feature {
        Objects.requireNonNull(name, "name must not be null");
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
        uses = uses == null ? List.of() : List.copyOf(uses);
        hooks = hooks == null ? List.of() : List.copyOf(hooks);
        scenarios = scenarios == null ? List.of() : List.copyOf(scenarios);
    }

    public boolean usesName(String name) {
        return uses.stream().anyMatch(use -> use.name().equals(name));
    }
}

package com.verolang.core.transpiler;

import java.util.Objects;

/**
 * One {@code test(...)} emitted by the transpiler.
 *
 * @param feature feature name
 * @param scenario scenario name
 * @param combinationLabel label of the parameter combination, or null for plain runs
 * @param title full test title as it appears in the generated script and in reports
 */
public record GeneratedTest(String feature, String scenario, String combinationLabel, String title) {

    public GeneratedTest {
        Objects.requireNonNull(feature, "feature must not be null");
        Objects.requireNonNull(scenario, "scenario must not be null");
        Objects.requireNonNull(title, "title must not be null");
    }
}

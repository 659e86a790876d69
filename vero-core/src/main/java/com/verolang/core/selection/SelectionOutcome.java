package com.verolang.core.selection;

import com.verolang.core.ast.Program;

import java.util.Objects;

/**
 * Result of applying a {@link ScenarioSelection}.
 *
 * <p>{@code selectedScenarios == 0} with {@code totalScenarios > 0} means the filters matched
 * nothing; {@code totalScenarios == 0} means there was nothing to select from.
 *
 * @param selected the program with only the selected scenarios; features without a selected
 *     scenario are dropped, pages and page actions are kept
 * @param totalScenarios scenarios before filtering
 * @param selectedScenarios scenarios after filtering
 * @param selectedFeatures features with at least one selected scenario
 * @param hasFilters whether any filter was given
 */
public record SelectionOutcome(
    Program selected,
    int totalScenarios,
    int selectedScenarios,
    int selectedFeatures,
    boolean hasFilters
) {
    public SelectionOutcome {
        Objects.requireNonNull(selected, "selected must not be null");
    }

    public boolean isEmptySelection() {
        return hasFilters && selectedScenarios == 0 && totalScenarios > 0;
    }
}

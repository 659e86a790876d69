package com.verolang.core.transpiler;

import com.verolang.core.selection.ScenarioSelection;

import java.util.List;

/**
 * Transpiler settings.
 *
 * @param selection scenarios to keep; {@link ScenarioSelection#none()} keeps all
 * @param combinations parameter sets; empty means one plain test per scenario
 * @param baseUrl emitted as {@code test.use({ baseURL })} in every feature, or null
 * @param indent spaces per indentation level, 1 to 8
 */
public record TranspileOptions(
    ScenarioSelection selection,
    List<ParamCombination> combinations,
    String baseUrl,
    int indent
) {
    public static final int DEFAULT_INDENT = 2;

    public TranspileOptions {
        if (selection == null) {
            selection = ScenarioSelection.none();
        }
        combinations = combinations == null ? List.of() : List.copyOf(combinations);
        if (baseUrl != null && baseUrl.isBlank()) {
            baseUrl = null;
        }
        if (indent < 1 || indent > 8) {
            throw new IllegalArgumentException("indent must be between 1 and 8, was " + indent);
        }
    }

    public static TranspileOptions defaults() {
        return new TranspileOptions(ScenarioSelection.none(), List.of(), null, DEFAULT_INDENT);
    }

    public TranspileOptions withSelection(ScenarioSelection newSelection) {
        return new TranspileOptions(newSelection, combinations, baseUrl, indent);
    }

    public TranspileOptions withCombinations(List<ParamCombination> newCombinations) {
        return new TranspileOptions(selection, newCombinations, baseUrl, indent);
    }

    public TranspileOptions withBaseUrl(String newBaseUrl) {
        return new TranspileOptions(selection, combinations, newBaseUrl, indent);
    }

    public TranspileOptions withIndent(int newIndent) {
        return new TranspileOptions(selection, combinations, baseUrl, newIndent);
    }
}

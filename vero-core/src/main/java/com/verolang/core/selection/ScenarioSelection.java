package com.verolang.core.selection;

import java.util.List;

/**
 * Filters that narrow the scenarios of a program. Empty lists and a null expression mean "no
 * filter"; a scenario is selected when every given filter passes.
 *
 * @param scenarioNames exact scenario names; matching ignores case and word separators
 * @param namePatterns regular expressions searched case-insensitively in the name
 * @param includeTags tags a scenario must carry, combined according to {@code tagMode}
 * @param excludeTags tags a scenario must not carry
 * @param tagMode combination rule for {@code includeTags}
 * @param tagExpression boolean tag expression such as {@code @smoke and not @slow}, or null
 */
public record ScenarioSelection(
    List<String> scenarioNames,
    List<String> namePatterns,
    List<String> includeTags,
    List<String> excludeTags,
    TagMode tagMode,
    String tagExpression
) {
    public ScenarioSelection {
        scenarioNames = clean(scenarioNames);
        namePatterns = clean(namePatterns);
        includeTags = clean(includeTags);
        excludeTags = clean(excludeTags);
        if (tagMode == null) {
            tagMode = TagMode.ANY;
        }
        if (tagExpression != null && tagExpression.isBlank()) {
            tagExpression = null;
        }
    }

    public static ScenarioSelection none() {
        return new ScenarioSelection(List.of(), List.of(), List.of(), List.of(), TagMode.ANY, null);
    }

    public static ScenarioSelection byNames(List<String> names) {
        return new ScenarioSelection(names, List.of(), List.of(), List.of(), TagMode.ANY, null);
    }

    public static ScenarioSelection byTags(List<String> tags, TagMode mode) {
        return new ScenarioSelection(List.of(), List.of(), tags, List.of(), mode, null);
    }

    public static ScenarioSelection byTagExpression(String expression) {
        return new ScenarioSelection(List.of(), List.of(), List.of(), List.of(), TagMode.ANY, expression);
    }

    public boolean hasFilters() {
        return !scenarioNames.isEmpty() || !namePatterns.isEmpty() || !includeTags.isEmpty()
            || !excludeTags.isEmpty() || tagExpression != null;
    }

    private static List<String> clean(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
            .filter(value -> value != null && !value.isBlank())
            .map(String::trim)
            .toList();
    }
}

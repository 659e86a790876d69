package com.verolang.core.transpiler;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * One named set of variable bindings for a parameterized run.
 *
 * <p>A blank label is derived from the values ({@code user=admin, role=editor}).
 *
 * @param label name appended to the generated test title
 * @param values bindings overlaid on the base environment, in insertion order
 */
public record ParamCombination(String label, Map<String, Object> values) {

    @JsonCreator
    public ParamCombination(
        @JsonProperty("label") String label,
        @JsonProperty("values") Map<String, Object> values
    ) {
        Map<String, Object> copy = values == null ? new LinkedHashMap<>() : new LinkedHashMap<>(values);
        this.values = Collections.unmodifiableMap(copy);
        this.label = label == null || label.isBlank() ? deriveLabel(copy) : label.trim();
    }

    public static ParamCombination of(String label, Map<String, Object> values) {
        return new ParamCombination(label, values);
    }

    private static String deriveLabel(Map<String, Object> values) {
        if (values.isEmpty()) {
            return "default";
        }
        return values.entrySet().stream()
            .map(entry -> entry.getKey() + "=" + entry.getValue())
            .collect(Collectors.joining(", "));
    }
}

package com.verolang.core.transpiler;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ParamCombination}.
 */
class ParamCombinationTest {

    @Test
    void constructor_blankLabel_derivesLabelFromValues() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("user", "admin");
        values.put("role", "editor");

        assertThat(ParamCombination.of("  ", values).label()).isEqualTo("user=admin, role=editor");
        assertThat(ParamCombination.of(null, Map.of()).label()).isEqualTo("default");
    }

    @Test
    void constructor_label_isTrimmed() {
        assertThat(ParamCombination.of(" chrome ", Map.of()).label()).isEqualTo("chrome");
    }

    @Test
    void values_areCopiedAndUnmodifiable() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("n", 1);
        ParamCombination combination = ParamCombination.of("one", values);
        values.put("m", 2);

        assertThat(combination.values()).containsOnlyKeys("n");
        assertThatThrownBy(() -> combination.values().put("x", 3))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void json_listOfCombinations_deserializes() throws Exception {
        String json = """
            [
              {"label": "admin", "values": {"role": "admin", "count": 2}},
              {"values": {"role": "guest"}}
            ]
            """;

        List<ParamCombination> combinations = new ObjectMapper().readValue(json, new TypeReference<List<ParamCombination>>() {});

        assertThat(combinations).extracting(ParamCombination::label).containsExactly("admin", "role=guest");
        assertThat(combinations.get(0).values()).containsEntry("count", 2);
    }
}

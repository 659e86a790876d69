package com.verolang.core.transpiler;

import com.verolang.core.selection.ScenarioSelection;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TranspileOptions}.
 */
class TranspileOptionsTest {

    @Test
    void defaults_keepAllScenariosWithTwoSpaceIndent() {
        TranspileOptions options = TranspileOptions.defaults();

        assertThat(options.selection().hasFilters()).isFalse();
        assertThat(options.combinations()).isEmpty();
        assertThat(options.baseUrl()).isNull();
        assertThat(options.indent()).isEqualTo(TranspileOptions.DEFAULT_INDENT);
    }

    @Test
    void constructor_nullsAndBlanks_fallBackToDefaults() {
        TranspileOptions options = new TranspileOptions(null, null, "  ", 2);

        assertThat(options.selection()).isEqualTo(ScenarioSelection.none());
        assertThat(options.combinations()).isEmpty();
        assertThat(options.baseUrl()).isNull();
    }

    @Test
    void constructor_indentOutOfRange_throws() {
        assertThatThrownBy(() -> TranspileOptions.defaults().withIndent(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("between 1 and 8");
        assertThatThrownBy(() -> TranspileOptions.defaults().withIndent(9))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withers_replaceOneSetting() {
        TranspileOptions options = TranspileOptions.defaults()
            .withBaseUrl("http://localhost:3000")
            .withCombinations(List.of(ParamCombination.of("a", Map.of())));

        assertThat(options.baseUrl()).isEqualTo("http://localhost:3000");
        assertThat(options.combinations()).hasSize(1);
        assertThat(options.indent()).isEqualTo(2);
    }
}

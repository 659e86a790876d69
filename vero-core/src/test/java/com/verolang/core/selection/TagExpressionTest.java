package com.verolang.core.selection;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TagExpression}.
 */
class TagExpressionTest {

    @Test
    void parse_singleTag_matchesIgnoringCaseAndAt() {
        TagExpression expression = TagExpression.parse("@Smoke");

        assertThat(expression).isEqualTo(new TagExpression.Tag("smoke"));
        assertThat(expression.matches(Set.of("smoke"))).isTrue();
        assertThat(expression.matches(Set.of("regression"))).isFalse();
    }

    @Test
    void parse_andBindsTighterThanOr() {
        TagExpression expression = TagExpression.parse("@a or @b and @c");

        assertThat(expression).isInstanceOf(TagExpression.Or.class);
        assertThat(expression.matches(Set.of("a"))).isTrue();
        assertThat(expression.matches(Set.of("b"))).isFalse();
        assertThat(expression.matches(Set.of("b", "c"))).isTrue();
    }

    @Test
    void parse_notBindsTighterThanAnd() {
        TagExpression expression = TagExpression.parse("smoke AND NOT slow");

        assertThat(expression.matches(Set.of("smoke"))).isTrue();
        assertThat(expression.matches(Set.of("smoke", "slow"))).isFalse();
    }

    @Test
    void parse_parenthesesOverridePrecedence() {
        TagExpression expression = TagExpression.parse("(@a or @b) and @c");

        assertThat(expression).isInstanceOf(TagExpression.And.class);
        assertThat(expression.matches(Set.of("a"))).isFalse();
        assertThat(expression.matches(Set.of("a", "c"))).isTrue();
    }

    @Test
    void parse_tagsWithDashesAndUnderscores_areSingleTags() {
        TagExpression expression = TagExpression.parse("@needs-login and @data_set");

        assertThat(expression.matches(Set.of("needs-login", "data_set"))).isTrue();
    }

    @Test
    void parse_missingClosingParenthesis_throws() {
        assertThatThrownBy(() -> TagExpression.parse("(@a or @b"))
            .isInstanceOf(ScenarioSelectionException.class)
            .hasMessageContaining("')'");
    }

    @Test
    void parse_danglingOperator_throws() {
        assertThatThrownBy(() -> TagExpression.parse("@a and"))
            .isInstanceOf(ScenarioSelectionException.class)
            .hasMessageContaining("expected a tag");
    }

    @Test
    void parse_unexpectedCharacter_throws() {
        assertThatThrownBy(() -> TagExpression.parse("@a & @b"))
            .isInstanceOf(ScenarioSelectionException.class)
            .hasMessageContaining("'&'");
    }

    @Test
    void parse_bareAt_throws() {
        assertThatThrownBy(() -> TagExpression.parse("@ smoke"))
            .isInstanceOf(ScenarioSelectionException.class)
            .hasMessageContaining("after '@'");
    }

    @Test
    void normalizeTag_stripsAtSignsAndLowercases() {
        assertThat(TagExpression.normalizeTag(" @@Smoke ")).isEqualTo("smoke");
        assertThat(TagExpression.normalizeTag("Login")).isEqualTo("login");
    }
}

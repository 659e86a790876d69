package com.verolang.core.selection;

import com.verolang.core.ast.Feature;
import com.verolang.core.ast.Page;
import com.verolang.core.ast.Program;
import com.verolang.core.ast.Scenario;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ScenarioSelector}.
 */
class ScenarioSelectorTest {

    private static final Program PROGRAM = new Program(
        List.of(new Page("LoginPage", List.of(), List.of(), List.of(), 1)),
        List.of(),
        List.of(
            feature("Login",
                scenario("SuccessfulLogin", "smoke", "auth"),
                scenario("locked account", "auth", "slow"),
                scenario("Forgot password")),
            feature("Checkout",
                scenario("pay by card", "smoke", "payments"),
                scenario("refund", "payments"))));

    @Test
    void select_withoutFilters_keepsEverything() {
        SelectionOutcome outcome = ScenarioSelector.select(PROGRAM, ScenarioSelection.none());

        assertThat(outcome.selected()).isSameAs(PROGRAM);
        assertThat(outcome.totalScenarios()).isEqualTo(5);
        assertThat(outcome.selectedScenarios()).isEqualTo(5);
        assertThat(outcome.selectedFeatures()).isEqualTo(2);
        assertThat(outcome.hasFilters()).isFalse();
        assertThat(outcome.isEmptySelection()).isFalse();
    }

    @Test
    void select_byName_matchesReadableFormOfName() {
        SelectionOutcome outcome = ScenarioSelector.select(PROGRAM,
            ScenarioSelection.byNames(List.of("successful login", "REFUND")));

        assertThat(scenarioNames(outcome)).containsExactly("SuccessfulLogin", "refund");
        assertThat(outcome.selectedFeatures()).isEqualTo(2);
    }

    @Test
    void select_anyTag_keepsScenariosWithOneOfTheTags() {
        SelectionOutcome outcome = ScenarioSelector.select(PROGRAM,
            ScenarioSelection.byTags(List.of("@Smoke", "slow"), TagMode.ANY));

        assertThat(scenarioNames(outcome)).containsExactly("SuccessfulLogin", "locked account", "pay by card");
    }

    @Test
    void select_allTags_keepsScenariosWithEveryTag() {
        SelectionOutcome outcome = ScenarioSelector.select(PROGRAM,
            ScenarioSelection.byTags(List.of("smoke", "auth"), TagMode.ALL));

        assertThat(scenarioNames(outcome)).containsExactly("SuccessfulLogin");
        assertThat(outcome.selected().features()).extracting(Feature::name).containsExactly("Login");
        assertThat(outcome.selected().pages()).hasSize(1);
    }

    @Test
    void select_excludeTags_dropsTaggedScenarios() {
        ScenarioSelection selection = new ScenarioSelection(
            List.of(), List.of(), List.of(), List.of("slow", "payments"), TagMode.ANY, null);

        SelectionOutcome outcome = ScenarioSelector.select(PROGRAM, selection);

        assertThat(scenarioNames(outcome)).containsExactly("SuccessfulLogin", "Forgot password");
    }

    @Test
    void select_namePattern_searchesCaseInsensitively() {
        ScenarioSelection selection = new ScenarioSelection(
            List.of(), List.of("^pay", "PASSWORD"), List.of(), List.of(), TagMode.ANY, null);

        SelectionOutcome outcome = ScenarioSelector.select(PROGRAM, selection);

        assertThat(scenarioNames(outcome)).containsExactly("Forgot password", "pay by card");
    }

    @Test
    void select_tagExpression_combinesWithOtherFilters() {
        ScenarioSelection selection = new ScenarioSelection(
            List.of(), List.of(), List.of(), List.of("slow"), TagMode.ANY, "@auth or @payments and not @smoke");

        SelectionOutcome outcome = ScenarioSelector.select(PROGRAM, selection);

        assertThat(scenarioNames(outcome)).containsExactly("SuccessfulLogin", "refund");
    }

    @Test
    void select_nothingMatches_reportsEmptySelection() {
        SelectionOutcome outcome = ScenarioSelector.select(PROGRAM,
            ScenarioSelection.byTagExpression("@nightly"));

        assertThat(outcome.selectedScenarios()).isZero();
        assertThat(outcome.selected().features()).isEmpty();
        assertThat(outcome.isEmptySelection()).isTrue();
    }

    @Test
    void select_emptyProgram_isNotAnEmptySelection() {
        SelectionOutcome outcome = ScenarioSelector.select(Program.empty(),
            ScenarioSelection.byTagExpression("@smoke"));

        assertThat(outcome.totalScenarios()).isZero();
        assertThat(outcome.isEmptySelection()).isFalse();
    }

    @Test
    void constructor_invalidNamePattern_throws() {
        ScenarioSelection selection = new ScenarioSelection(
            List.of(), List.of("(unclosed"), List.of(), List.of(), TagMode.ANY, null);

        assertThatThrownBy(() -> new ScenarioSelector(selection))
            .isInstanceOf(ScenarioSelectionException.class)
            .hasMessageContaining("(unclosed");
    }

    @Test
    void selection_blankValues_areIgnored() {
        ScenarioSelection selection = new ScenarioSelection(
            List.of(" "), null, List.of(""), null, null, "  ");

        assertThat(selection.hasFilters()).isFalse();
        assertThat(selection.tagMode()).isEqualTo(TagMode.ANY);
    }

    @Test
    void tagModeFromId_unknownValue_throws() {
        assertThat(TagMode.fromId("ALL")).isEqualTo(TagMode.ALL);
        assertThat(TagMode.fromId(null)).isEqualTo(TagMode.ANY);
        assertThatThrownBy(() -> TagMode.fromId("some"))
            .isInstanceOf(ScenarioSelectionException.class)
            .hasMessageContaining("'some'");
    }

    @Test
    void readableName_splitsCamelCaseAndPunctuation() {
        assertThat(ScenarioSelector.readableName("SuccessfulLogin")).isEqualTo("successful login");
        assertThat(ScenarioSelector.readableName("HTMLExport")).isEqualTo("html export");
        assertThat(ScenarioSelector.readableName("successful login!")).isEqualTo("successful login");
    }

    private static List<String> scenarioNames(SelectionOutcome outcome) {
        return outcome.selected().features().stream()
            .flatMap(feature -> feature.scenarios().stream())
            .map(Scenario::name)
            .toList();
    }

    private static Feature feature(String name, Scenario... scenarios) {
        return new Feature(name, List.of(), List.of(), List.of(), List.of(scenarios), 1);
    }

    private static Scenario scenario(String name, String... tags) {
        return new Scenario(name, List.of(tags), List.of(), 1);
    }
}

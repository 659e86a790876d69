package com.verolang.core.selection;

import com.verolang.core.ast.Feature;
import com.verolang.core.ast.Program;
import com.verolang.core.ast.Scenario;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Applies a {@link ScenarioSelection} to a program.
 *
 * <p>Patterns and the tag expression are compiled once in the constructor, so a malformed
 * selection fails before any program is touched.
 */
public final class ScenarioSelector {

    private static final Logger log = LoggerFactory.getLogger(ScenarioSelector.class);

    private static final Pattern LOWER_UPPER = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern ACRONYM = Pattern.compile("([A-Z]+)([A-Z][a-z])");
    private static final Pattern NON_WORD = Pattern.compile("[^A-Za-z0-9]+");

    private final ScenarioSelection selection;
    private final Set<String> exactNames;
    private final Set<String> comparableNames;
    private final List<Pattern> patterns;
    private final Set<String> includeTags;
    private final Set<String> excludeTags;
    private final TagExpression tagExpression;

    /**
     * @param selection filters to apply
     * @throws ScenarioSelectionException when a name pattern or the tag expression is malformed
     */
    public ScenarioSelector(ScenarioSelection selection) {
        this.selection = Objects.requireNonNull(selection, "selection must not be null");
        this.exactNames = selection.scenarioNames().stream()
            .map(name -> name.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
        this.comparableNames = selection.scenarioNames().stream()
            .map(ScenarioSelector::readableName)
            .collect(Collectors.toSet());
        this.patterns = selection.namePatterns().stream().map(ScenarioSelector::compile).toList();
        this.includeTags = selection.includeTags().stream().map(TagExpression::normalizeTag).collect(Collectors.toSet());
        this.excludeTags = selection.excludeTags().stream().map(TagExpression::normalizeTag).collect(Collectors.toSet());
        this.tagExpression = selection.tagExpression() == null ? null : TagExpression.parse(selection.tagExpression());
    }

    public static SelectionOutcome select(Program program, ScenarioSelection selection) {
        return new ScenarioSelector(selection).select(program);
    }

    /**
     * Keeps the scenarios that pass every filter, in source order.
     *
     * @param program program to filter
     * @return filtered program and counts
     */
    public SelectionOutcome select(Program program) {
        int total = program.scenarioCount();
        if (!selection.hasFilters()) {
            return new SelectionOutcome(program, total, total, program.features().size(), false);
        }

        List<Feature> features = new ArrayList<>();
        int selected = 0;
        for (Feature feature : program.features()) {
            List<Scenario> scenarios = feature.scenarios().stream().filter(this::matches).toList();
            if (scenarios.isEmpty()) {
                continue;
            }
            features.add(new Feature(feature.name(), feature.annotations(), feature.uses(), feature.hooks(),
                scenarios, feature.line()));
            selected += scenarios.size();
        }

        if (selected == 0) {
            log.warn("No scenarios matched the selection ({} scenarios available)", total);
        } else {
            log.debug("Selected {} of {} scenarios in {} features", selected, total, features.size());
        }
        Program filtered = new Program(program.pages(), program.pageActions(), features);
        return new SelectionOutcome(filtered, total, selected, features.size(), true);
    }

    public boolean matches(Scenario scenario) {
        String name = scenario.name();
        if (!exactNames.isEmpty()
            && !exactNames.contains(name.trim().toLowerCase(Locale.ROOT))
            && !comparableNames.contains(readableName(name))) {
            return false;
        }

        if (!patterns.isEmpty()) {
            String readable = readableName(name);
            boolean found = patterns.stream()
                .anyMatch(pattern -> pattern.matcher(name).find() || pattern.matcher(readable).find());
            if (!found) {
                return false;
            }
        }

        Set<String> tags = scenario.tags().stream().map(TagExpression::normalizeTag).collect(Collectors.toSet());
        if (!includeTags.isEmpty()) {
            boolean included = selection.tagMode() == TagMode.ALL
                ? tags.containsAll(includeTags)
                : includeTags.stream().anyMatch(tags::contains);
            if (!included) {
                return false;
            }
        }
        if (excludeTags.stream().anyMatch(tags::contains)) {
            return false;
        }
        return tagExpression == null || tagExpression.matches(tags);
    }

    /**
     * Lowercase words separated by single spaces: {@code SuccessfulLogin} and
     * {@code "successful login!"} both become {@code successful login}.
     */
    static String readableName(String name) {
        String split = LOWER_UPPER.matcher(name).replaceAll("$1 $2");
        split = ACRONYM.matcher(split).replaceAll("$1 $2");
        split = NON_WORD.matcher(split).replaceAll(" ").trim().toLowerCase(Locale.ROOT);
        if (split.isEmpty()) {
            return name;
        }
        return Arrays.stream(split.split("\\s+")).collect(Collectors.joining(" "));
    }

    private static Pattern compile(String pattern) {
        try {
            return Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            throw new ScenarioSelectionException("Invalid name pattern '" + pattern + "': " + e.getDescription(), e);
        }
    }
}

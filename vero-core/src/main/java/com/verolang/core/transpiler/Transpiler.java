package com.verolang.core.transpiler;

import com.verolang.core.ast.ActionDefinition;
import com.verolang.core.ast.Feature;
import com.verolang.core.ast.Field;
import com.verolang.core.ast.Hook;
import com.verolang.core.ast.Page;
import com.verolang.core.ast.PageActions;
import com.verolang.core.ast.Program;
import com.verolang.core.ast.Scenario;
import com.verolang.core.ast.UseRef;
import com.verolang.core.ast.Variable;
import com.verolang.core.selection.ScenarioSelector;
import com.verolang.core.selection.SelectionOutcome;
import com.verolang.core.selection.TagExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lowers a validated {@link Program} to a Playwright Test script in TypeScript.
 *
 * <p>Output order is fixed: the shared prelude, one class per page, one class per page actions
 * library, then one {@code test.describe} per feature holding one {@code test} per selected
 * scenario and parameter combination, in source order.
 *
 * <p>The program must already pass validation, with sibling declarations merged in through
 * {@link Program#withContext}. References validation would reject raise
 * {@link TranspilerContractException}.
 */
public final class Transpiler {

    private static final Logger log = LoggerFactory.getLogger(Transpiler.class);

    private static final String HEADER = "// Generated by vero. Do not edit.";
    private static final String PRELUDE = loadPrelude();

    private final TranspileOptions options;
    private final Map<String, Page> pages = new LinkedHashMap<>();
    private final Map<String, PageActions> libraries = new LinkedHashMap<>();
    private final Resolver resolver;
    private final CodeWriter out;
    private final List<GeneratedTest> tests = new ArrayList<>();

    private Transpiler(Program program, TranspileOptions options) {
        this.options = options;
        program.pages().forEach(page -> pages.put(page.name(), page));
        program.pageActions().forEach(library -> libraries.put(library.name(), library));
        this.resolver = new Resolver(pages, libraries);
        this.out = new CodeWriter(options.indent());
    }

    public static TranspileResult transpile(Program program) {
        return transpile(program, TranspileOptions.defaults());
    }

    /**
     * Selects scenarios, then generates the script.
     *
     * @param program validated program
     * @param options selection, combinations and formatting
     * @return generated code and scenario counts
     * @throws com.verolang.core.selection.ScenarioSelectionException when the selection is malformed
     * @throws TranspilerContractException when the program references something undeclared
     */
    public static TranspileResult transpile(Program program, TranspileOptions options) {
        Objects.requireNonNull(program, "program must not be null");
        Objects.requireNonNull(options, "options must not be null");

        SelectionOutcome outcome = ScenarioSelector.select(program, options.selection());
        Transpiler transpiler = new Transpiler(outcome.selected(), options);
        String code = transpiler.generate(outcome.selected());

        log.debug("Transpiled {} of {} scenarios into {} tests",
            outcome.selectedScenarios(), outcome.totalScenarios(), transpiler.tests.size());
        return new TranspileResult(code, outcome.totalScenarios(), outcome.selectedScenarios(), transpiler.tests);
    }

    private String generate(Program program) {
        out.line(HEADER);
        out.raw(PRELUDE);
        program.pages().forEach(this::pageClass);
        program.pageActions().forEach(this::libraryClass);
        program.features().forEach(this::feature);
        return out.toString();
    }

    // Pages and libraries

    private void pageClass(Page page) {
        out.blank();
        out.open("class " + TypeScript.className(page.name()) + " {");
        out.line("readonly page: Page;");
        for (Field field : page.fields()) {
            out.line("readonly " + field.name() + ": Locator;");
        }
        for (Variable variable : page.variables()) {
            out.line(variable.name() + ": " + variable.type().typeScriptType() + ";");
        }
        out.blank();

        Map<String, String> self = Map.of(page.name(), "this");
        EmitScope constructorScope = EmitScope.forAction(self, page.name(), null, List.of());
        out.open("constructor(page: Page) {");
        out.line("this.page = page;");
        for (Field field : page.fields()) {
            out.line("this." + field.name() + " = " + Locators.locator("page", field.selector()) + ";");
        }
        for (Variable variable : page.variables()) {
            out.line("this." + variable.name() + " = " + resolver.expression(variable.value(), constructorScope) + ";");
        }
        out.close("}");

        for (ActionDefinition action : page.actions()) {
            actionMethod(action, EmitScope.forAction(self, page.name(), null, action.parameters()));
        }
        out.close("}");
    }

    private void libraryClass(PageActions library) {
        Map<String, String> self = new LinkedHashMap<>();
        self.put(library.name(), "this");
        String forField = null;
        if (library.forPage() != null) {
            if (!pages.containsKey(library.forPage())) {
                throw new TranspilerContractException(
                    "Page actions '" + library.name() + "' targets unknown page '" + library.forPage() + "'");
            }
            forField = TypeScript.instanceName(library.forPage());
            self.put(library.forPage(), "this." + forField);
        }

        out.blank();
        out.open("class " + TypeScript.className(library.name()) + " {");
        out.line("readonly page: Page;");
        if (forField != null) {
            out.line("readonly " + forField + ": " + TypeScript.className(library.forPage()) + ";");
        }
        out.blank();
        out.open("constructor(page: Page) {");
        out.line("this.page = page;");
        if (forField != null) {
            out.line("this." + forField + " = new " + TypeScript.className(library.forPage()) + "(page);");
        }
        out.close("}");

        for (ActionDefinition action : library.actions()) {
            actionMethod(action, EmitScope.forAction(self, library.forPage(), library.name(), action.parameters()));
        }
        out.close("}");
    }

    private void actionMethod(ActionDefinition action, EmitScope scope) {
        String parameters = action.parameters().stream()
            .map(parameter -> parameter + ": any")
            .collect(Collectors.joining(", "));
        String returns = action.returnType() == null ? "" : ": Promise<" + action.returnType().typeScriptType() + ">";
        out.blank();
        out.open("async " + action.name() + "(" + parameters + ")" + returns + " {");
        new StatementEmitter(out, resolver, scope).emit(action.statements());
        out.close("}");
    }

    // Features

    private void feature(Feature feature) {
        Map<String, String> instances = instancesFor(feature);

        out.blank();
        out.open(describe(feature.annotations()) + "(" + TypeScript.quote(feature.name()) + ", () => {");
        if (options.baseUrl() != null) {
            out.line("test.use({ baseURL: " + TypeScript.quote(options.baseUrl()) + " });");
        }

        List<ScenarioCase> cases = cases(feature);
        if (!options.combinations().isEmpty()) {
            combinationTable(cases);
        }
        for (Hook hook : feature.hooks()) {
            hook(hook, instances);
        }
        for (ScenarioCase scenarioCase : cases) {
            scenario(feature, scenarioCase, instances);
        }
        out.close("});");
    }

    private Map<String, String> instancesFor(Feature feature) {
        Map<String, String> instances = new LinkedHashMap<>();
        for (UseRef use : feature.uses()) {
            if (!pages.containsKey(use.name()) && !libraries.containsKey(use.name())) {
                throw new TranspilerContractException(
                    "Feature '" + feature.name() + "' uses unknown page '" + use.name() + "'");
            }
            instances.put(use.name(), TypeScript.instanceName(use.name()));
        }
        return instances;
    }

    private static String describe(List<String> annotations) {
        if (annotations.contains("only")) {
            return "test.describe.only";
        }
        if (annotations.contains("skip")) {
            return "test.describe.skip";
        }
        if (annotations.contains("serial")) {
            return "test.describe.serial";
        }
        return "test.describe";
    }

    /**
     * Binds each combination test to its values before any user hook runs.
     */
    private void combinationTable(List<ScenarioCase> cases) {
        out.open("const __combinations__: Record<string, Record<string, any>> = {");
        for (ScenarioCase scenarioCase : cases) {
            out.line(TypeScript.quote(scenarioCase.title()) + ": "
                + TypeScript.objectLiteral(scenarioCase.combination().values()) + ",");
        }
        out.close("};");
        out.blank();
        out.open("test.beforeEach(async ({}, testInfo) => {");
        out.line("__env__ = { ...__baseEnv__, ...(__combinations__[testInfo.title] ?? {}) };");
        out.close("});");
    }

    private void hook(Hook hook, Map<String, String> instances) {
        String function = switch (hook.type()) {
            case BEFORE_ALL -> "test.beforeAll";
            case BEFORE_EACH -> "test.beforeEach";
            case AFTER_ALL -> "test.afterAll";
            case AFTER_EACH -> "test.afterEach";
        };

        out.blank();
        if (hook.type().isOnce()) {
            out.open(function + "(async ({ browser }) => {");
            out.line("const page = await browser.newPage();");
            out.open("try {");
            body(hook, instances, false);
            out.reopen("} finally {");
            out.line("await page.close();");
            out.close("}");
        } else {
            out.open(function + "(async ({ page }) => {");
            body(hook, instances, true);
        }
        out.close("});");
    }

    private void body(Hook hook, Map<String, String> instances, boolean tabsAllowed) {
        declareInstances(instances, tabsAllowed);
        new StatementEmitter(out, resolver, EmitScope.forTest(instances, tabsAllowed)).emit(hook.statements());
    }

    private void scenario(Feature feature, ScenarioCase scenarioCase, Map<String, String> instances) {
        Scenario scenario = scenarioCase.scenario();
        Set<String> tags = scenario.tags().stream().map(TagExpression::normalizeTag).collect(Collectors.toSet());

        out.blank();
        out.open(testFunction(tags) + "(" + TypeScript.quote(scenarioCase.title()) + ", async ({ page }) => {");
        if (tags.contains("slow")) {
            out.line("test.slow();");
        }
        declareInstances(instances, true);
        new StatementEmitter(out, resolver, EmitScope.forTest(instances, true)).emit(scenario.statements());
        out.close("});");

        String label = scenarioCase.combination() == null ? null : scenarioCase.label();
        tests.add(new GeneratedTest(feature.name(), scenario.name(), label, scenarioCase.title()));
    }

    private static String testFunction(Set<String> tags) {
        if (tags.contains("only")) {
            return "test.only";
        }
        if (tags.contains("skip")) {
            return "test.skip";
        }
        if (tags.contains("fixme")) {
            return "test.fixme";
        }
        return "test";
    }

    private void declareInstances(Map<String, String> instances, boolean reassignable) {
        String keyword = reassignable ? "let " : "const ";
        instances.forEach((name, local) ->
            out.line(keyword + local + " = new " + TypeScript.className(name) + "(page);"));
    }

    // Combinations

    private List<ScenarioCase> cases(Feature feature) {
        List<ParamCombination> combinations = options.combinations();
        List<String> labels = uniqueLabels(combinations);
        List<ScenarioCase> cases = new ArrayList<>();
        Set<String> titles = new HashSet<>();
        for (Scenario scenario : feature.scenarios()) {
            if (combinations.isEmpty()) {
                cases.add(new ScenarioCase(scenario, null, null, unique(title(scenario, null), titles)));
                continue;
            }
            for (int i = 0; i < combinations.size(); i++) {
                String label = labels.get(i);
                cases.add(new ScenarioCase(scenario, combinations.get(i), label,
                    unique(title(scenario, label), titles)));
            }
        }
        return cases;
    }

    /**
     * Repeated labels get {@code #2}, {@code #3}, ... from their second occurrence on, skipping
     * any suffixed form another combination already uses.
     */
    static List<String> uniqueLabels(List<ParamCombination> combinations) {
        Set<String> taken = new HashSet<>();
        List<String> labels = new ArrayList<>();
        for (ParamCombination combination : combinations) {
            labels.add(unique(combination.label(), taken));
        }
        return labels;
    }

    /**
     * Returns {@code name}, or the first free {@code name #n}, and marks the result as taken.
     */
    static String unique(String name, Set<String> taken) {
        if (taken.add(name)) {
            return name;
        }
        int occurrence = 2;
        while (!taken.add(name + " #" + occurrence)) {
            occurrence++;
        }
        return name + " #" + occurrence;
    }

    private static String title(Scenario scenario, String label) {
        StringBuilder title = new StringBuilder(scenario.name());
        if (label != null) {
            title.append(" [").append(label).append(']');
        }
        for (String tag : scenario.tags()) {
            title.append(" @").append(tag.startsWith("@") ? tag.substring(1) : tag);
        }
        return title.toString();
    }

    private record ScenarioCase(Scenario scenario, ParamCombination combination, String label, String title) {
    }

    private static String loadPrelude() {
        try (InputStream in = Transpiler.class.getResourceAsStream("prelude.ts")) {
            if (in == null) {
                throw new IllegalStateException("Transpiler prelude resource is missing");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read transpiler prelude", e);
        }
    }
}

package com.verolang.core.validator;

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
import com.verolang.core.error.ValidationErrors;
import com.verolang.core.error.VeroError;
import com.verolang.core.util.NameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Semantic checks over a parsed {@link Program}.
 *
 * <p>Validation runs in two passes. The first registers every page and page actions library,
 * from the {@link ValidationContext} first and then from the program, reporting duplicates. The
 * second walks features, hooks, scenarios and action bodies and resolves every reference.
 *
 * <p>All statements are checked even after an error, so one pass reports as many problems as
 * possible. Heuristic findings (a field or variable that may be supplied at run time, naming
 * conventions) are warnings.
 */
public final class Validator {

    private static final Logger log = LoggerFactory.getLogger(Validator.class);

    private final Definitions definitions = new Definitions();
    private final List<VeroError> diagnostics = new ArrayList<>();

    private Validator() {
    }

    public static ValidationResult validate(Program program) {
        return validate(program, ValidationContext.empty());
    }

    /**
     * Validates {@code program} against its own declarations and those of {@code context}.
     *
     * @param program parsed program
     * @param context sibling declarations, may be empty
     * @return errors and warnings
     */
    public static ValidationResult validate(Program program, ValidationContext context) {
        Objects.requireNonNull(program, "program must not be null");
        Objects.requireNonNull(context, "context must not be null");

        Validator validator = new Validator();
        validator.collectDefinitions(program, context);
        validator.checkDeclarations(program);
        program.features().forEach(validator::checkFeature);

        ValidationResult result = ValidationResult.of(validator.diagnostics);
        log.debug("Validated {} features: {} errors, {} warnings",
            program.features().size(), result.errors().size(), result.warnings().size());
        return result;
    }

    // Pass 1: definitions

    private void collectDefinitions(Program program, ValidationContext context) {
        context.pages().forEach(definitions::register);
        context.pageActions().forEach(definitions::register);

        for (Page page : program.pages()) {
            if (definitions.isDefined(page.name())) {
                diagnostics.add(ValidationErrors.duplicateDefinition("page", page.name(), page.line()));
            }
            definitions.register(page);
            checkPageMembers(page);
            checkPascalCase("Page", page.name(), page.line());
        }
        for (PageActions library : program.pageActions()) {
            if (definitions.isDefined(library.name())) {
                diagnostics.add(ValidationErrors.duplicateDefinition("page actions", library.name(), library.line()));
            }
            definitions.register(library);
            checkDuplicateActions(library.actions());
            checkPascalCase("PageActions", library.name(), library.line());
        }
    }

    private void checkPageMembers(Page page) {
        Set<String> fieldNames = new HashSet<>();
        for (Field field : page.fields()) {
            if (!fieldNames.add(field.name())) {
                diagnostics.add(ValidationErrors.duplicateDefinition("field", page.name() + "." + field.name(), field.line()));
            }
            if (!NameUtils.isCamelCase(field.name())) {
                diagnostics.add(ValidationErrors.namingConvention("Field", field.name(), "camelCase",
                    NameUtils.toCamelCase(field.name()), field.line()));
            }
        }
        Set<String> variableNames = new HashSet<>();
        for (Variable variable : page.variables()) {
            if (!variableNames.add(variable.name())) {
                diagnostics.add(ValidationErrors.duplicateDefinition("variable",
                    page.name() + "." + variable.name(), variable.line()));
            }
        }
        checkDuplicateActions(page.actions());
    }

    private void checkDuplicateActions(List<ActionDefinition> actions) {
        Set<String> names = new HashSet<>();
        for (ActionDefinition action : actions) {
            if (!names.add(action.name())) {
                diagnostics.add(ValidationErrors.duplicateDefinition("action", action.name(), action.line()));
            }
        }
    }

    private void checkPascalCase(String kind, String name, int line) {
        if (!NameUtils.isPascalCase(name)) {
            diagnostics.add(ValidationErrors.namingConvention(kind, name, "PascalCase",
                NameUtils.toPascalCase(name), line));
        }
    }

    // Pass 2: references

    private void checkDeclarations(Program program) {
        List<String> everything = definitions.allNames();
        for (Page page : program.pages()) {
            for (ActionDefinition action : page.actions()) {
                checkActionBody(action, page, everything);
            }
        }
        for (PageActions library : program.pageActions()) {
            Page forPage = null;
            if (library.forPage() != null) {
                forPage = definitions.page(library.forPage()).orElse(null);
                if (forPage == null) {
                    diagnostics.add(ValidationErrors.invalidPageActionsTarget(library.name(), library.forPage(),
                        library.line(), NameUtils.findSimilar(library.forPage(), definitions.pageNames())));
                }
            }
            for (ActionDefinition action : library.actions()) {
                checkActionBody(action, forPage, everything);
            }
        }
    }

    private void checkActionBody(ActionDefinition action, Page owner, List<String> visible) {
        new StatementChecker(definitions, diagnostics, visible, owner, "action definitions", action.parameters())
            .check(action.statements());
    }

    private void checkFeature(Feature feature) {
        List<String> visible = new ArrayList<>();
        for (UseRef use : feature.uses()) {
            if (definitions.isDefined(use.name())) {
                visible.add(use.name());
            } else {
                diagnostics.add(ValidationErrors.unresolvedUse(use.name(), use.line(),
                    NameUtils.findSimilar(use.name(), definitions.allNames())));
            }
        }

        for (Hook hook : feature.hooks()) {
            String restriction = hook.type().isOnce() ? "BEFORE ALL and AFTER ALL hooks" : null;
            new StatementChecker(definitions, diagnostics, visible, null, restriction, List.of())
                .check(hook.statements());
        }
        Set<String> scenarioNames = new HashSet<>();
        for (Scenario scenario : feature.scenarios()) {
            if (!scenarioNames.add(scenario.name())) {
                diagnostics.add(ValidationErrors.duplicateScenario(feature.name(), scenario.name(), scenario.line()));
            }
            new StatementChecker(definitions, diagnostics, visible, null, null, List.of())
                .check(scenario.statements());
        }
    }
}

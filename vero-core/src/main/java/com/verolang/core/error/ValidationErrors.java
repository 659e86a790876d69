package com.verolang.core.error;

import java.util.List;

/**
 * Factories for semantic validation diagnostics.
 *
 * <p>{@code similar} arguments carry "did you mean" candidates; an empty list adds no
 * suggestion.
 */
public final class ValidationErrors {

    private ValidationErrors() {
        // Utility class
    }

    public static VeroError duplicateDefinition(String kind, String name, int line) {
        return VeroError.builder(ErrorCode.DUPLICATE_DEFINITION)
            .location(ErrorLocation.atLine(line))
            .whatWentWrong("Duplicate " + kind + " definition: '" + name + "'")
            .howToFix("Rename one of the " + kind + "s or remove the duplicate. The last definition is used.")
            .build();
    }

    /**
     * Two scenarios of one feature share a name; both still run, the second under a numbered title.
     */
    public static VeroError duplicateScenario(String feature, String name, int line) {
        return VeroError.builder(ErrorCode.DUPLICATE_DEFINITION)
            .location(ErrorLocation.atLine(line))
            .whatWentWrong("Duplicate scenario '" + name + "' in feature '" + feature + "'")
            .howToFix("Give each scenario in the feature its own name.")
            .build();
    }

    public static VeroError unresolvedUse(String name, int line, List<String> similar) {
        return withSimilar(VeroError.builder(ErrorCode.UNRESOLVED_USE)
            .location(ErrorLocation.atLine(line))
            .whatWentWrong("'" + name + "' is not defined")
            .howToFix("Create PAGE " + name + " or PAGEACTIONS " + name + ", or fix the name."), similar)
            .build();
    }

    public static VeroError pageNotImported(String page, boolean defined, int line) {
        String what = defined
            ? "Page '" + page + "' is used but not in the USE list"
            : "Page '" + page + "' is not defined or imported";
        return VeroError.builder(ErrorCode.PAGE_NOT_IMPORTED)
            .location(ErrorLocation.atLine(line))
            .whatWentWrong(what)
            .howToFix("Add 'USE " + page + "' at the top of the feature.")
            .suggestion(ErrorSuggestion.fix("USE " + page))
            .build();
    }

    public static VeroError undefinedAction(String owner, String action, int line, List<String> similar) {
        String what = owner == null
            ? "Action '" + action + "' is not defined"
            : "Action '" + action + "' is not defined in '" + owner + "'";
        return withSimilar(VeroError.builder(ErrorCode.UNDEFINED_ACTION)
            .location(ErrorLocation.atLine(line))
            .whatWentWrong(what)
            .howToFix("Define the action or call one that exists."), similar)
            .build();
    }

    public static VeroError undefinedCollection(String name, int line) {
        return VeroError.builder(ErrorCode.UNDEFINED_COLLECTION)
            .location(ErrorLocation.atLine(line))
            .whatWentWrong("Collection '" + name + "' is not defined")
            .howToFix("Load it first, for example: ROWS " + name + " = TableName")
            .build();
    }

    public static VeroError undefinedVariable(String page, String name, int line, List<String> similar) {
        String what = page == null
            ? "Variable '" + name + "' may not be defined"
            : "Variable '" + name + "' may not be defined on page '" + page + "'";
        return withSimilar(VeroError.builder(ErrorCode.UNDEFINED_VARIABLE)
            .location(ErrorLocation.atLine(line))
            .whatWentWrong(what)
            .howToFix("Declare the variable before using it, or supply it as an environment value."), similar)
            .build();
    }

    public static VeroError undefinedField(String page, String field, int line, List<String> similar) {
        String what = page == null
            ? "Field '" + field + "' may not be defined on any used page"
            : "Field '" + field + "' may not be defined on page '" + page + "'";
        return withSimilar(VeroError.builder(ErrorCode.UNDEFINED_FIELD)
            .location(ErrorLocation.atLine(line))
            .whatWentWrong(what)
            .howToFix("Add 'FIELD " + field + " = \"selector\"' to the page."), similar)
            .build();
    }

    public static VeroError invalidPageActionsTarget(String pageActions, String page, int line, List<String> similar) {
        return withSimilar(VeroError.builder(ErrorCode.INVALID_PAGE_ACTIONS_TARGET)
            .location(ErrorLocation.atLine(line))
            .whatWentWrong("PAGEACTIONS '" + pageActions + "' is for page '" + page + "' which is not defined")
            .howToFix("Define PAGE " + page + " or point FOR at an existing page."), similar)
            .build();
    }

    public static VeroError tabOperationNotAllowed(String where, int line) {
        return VeroError.builder(ErrorCode.TAB_OPERATION_NOT_ALLOWED)
            .location(ErrorLocation.atLine(line))
            .whatWentWrong("Tab operations are not allowed in " + where)
            .howToFix("Move tab switching into a scenario or a BEFORE/AFTER EACH hook.")
            .build();
    }

    public static VeroError wrongArgumentCount(String owner, String action, int expected, int actual, int line) {
        return VeroError.builder(ErrorCode.WRONG_ARGUMENT_COUNT)
            .location(ErrorLocation.atLine(line))
            .whatWentWrong("Action '" + owner + "." + action + "' expects " + expected
                + " argument(s) but got " + actual)
            .howToFix("Pass exactly " + expected + " value(s) after WITH.")
            .expectedValue(String.valueOf(expected))
            .actualValue(String.valueOf(actual))
            .build();
    }

    public static VeroError namingConvention(String kind, String name, String convention, String suggested, int line) {
        return VeroError.builder(ErrorCode.NAMING_CONVENTION)
            .location(ErrorLocation.atLine(line))
            .whatWentWrong(kind + " name '" + name + "' should be " + convention)
            .howToFix("Rename it to '" + suggested + "'.")
            .suggestion(ErrorSuggestion.fix("Rename to " + suggested))
            .build();
    }

    private static VeroError.Builder withSimilar(VeroError.Builder builder, List<String> similar) {
        if (similar != null) {
            similar.forEach(candidate -> builder.suggestion(ErrorSuggestion.fix("Did you mean '" + candidate + "'?")));
        }
        return builder;
    }
}

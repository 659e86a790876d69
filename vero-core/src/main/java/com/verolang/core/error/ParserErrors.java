package com.verolang.core.error;

/**
 * Factories for syntax errors. Every message states what was expected and what was found.
 */
public final class ParserErrors {

    private ParserErrors() {
        // Utility class
    }

    public static VeroError missingKeyword(String expected, String found, int line, int column) {
        return syntax(ErrorCode.MISSING_KEYWORD, "Expected " + expected, found, line, column)
            .howToFix("Add the keyword " + expected + ".")
            .suggestion(ErrorSuggestion.fix("Add " + expected))
            .build();
    }

    public static VeroError missingBrace(String brace, String found, int line, int column) {
        return syntax(ErrorCode.MISSING_BRACE, "Expected '" + brace + "'", found, line, column)
            .howToFix("Every block opened with '{' must be closed with '}'.")
            .suggestion(ErrorSuggestion.fix("Add '" + brace + "'"))
            .build();
    }

    public static VeroError invalidStatement(String found, int line, int column) {
        return syntax(ErrorCode.INVALID_STATEMENT, "Expected a statement", found, line, column)
            .howToFix("Start the line with an action such as CLICK, FILL, OPEN or VERIFY.")
            .build();
    }

    public static VeroError missingString(String context, String found, int line, int column) {
        return syntax(ErrorCode.MISSING_STRING, "Expected a quoted string " + context, found, line, column)
            .howToFix("Put the value in double quotes, for example \"Submit\".")
            .build();
    }

    public static VeroError missingName(String context, String found, int line, int column) {
        return syntax(ErrorCode.MISSING_NAME, "Expected a name " + context, found, line, column)
            .howToFix("Names start with a letter and contain letters, digits or '_'.")
            .build();
    }

    public static VeroError unexpectedToken(String expected, String found, int line, int column) {
        return syntax(ErrorCode.UNEXPECTED_TOKEN, "Expected " + expected, found, line, column)
            .howToFix("Check the statement against the Vero syntax.")
            .build();
    }

    public static VeroError incompleteStatement(String expected, int line, int column) {
        return VeroError.builder(ErrorCode.INCOMPLETE_STATEMENT)
            .location(ErrorLocation.at(line, column))
            .whatWentWrong("Expected " + expected + " but reached the end of the file")
            .howToFix("Finish the statement and close every open block.")
            .build();
    }

    private static VeroError.Builder syntax(ErrorCode code, String expected, String found, int line, int column) {
        return VeroError.builder(code)
            .location(ErrorLocation.at(line, column))
            .whatWentWrong(expected + " at '" + found + "'")
            .technicalMessage(expected + " but found '" + found + "' at " + line + ":" + column);
    }
}

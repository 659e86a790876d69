package com.verolang.core.error;

/**
 * Factories for lexical errors.
 */
public final class LexerErrors {

    private LexerErrors() {
        // Utility class
    }

    public static VeroError unexpectedCharacter(char ch, int line, int column) {
        String shown = Character.isISOControl(ch) ? String.format("\\u%04x", (int) ch) : String.valueOf(ch);
        return VeroError.builder(ErrorCode.UNEXPECTED_CHARACTER)
            .location(ErrorLocation.at(line, column))
            .whatWentWrong("Unexpected character: '" + shown + "'")
            .howToFix("Remove the character or put it inside a quoted string.")
            .technicalMessage("Unexpected character '" + shown + "' at " + line + ":" + column)
            .build();
    }

    public static VeroError unterminatedString(int line, int column) {
        return VeroError.builder(ErrorCode.UNTERMINATED_STRING)
            .location(ErrorLocation.at(line, column))
            .whatWentWrong("Unterminated string")
            .howToFix("Close the string with a matching quote on the same line.")
            .suggestion(ErrorSuggestion.fix("Add the closing quote"))
            .build();
    }

    public static VeroError invalidNumber(String text, int line, int column) {
        return VeroError.builder(ErrorCode.INVALID_NUMBER)
            .location(ErrorLocation.at(line, column))
            .whatWentWrong("'" + text + "' is not a valid number")
            .howToFix("Write numbers like 42, -3 or 2.5. Quote the value if it is text.")
            .build();
    }

    public static VeroError unknownToken(String text, int line, int column) {
        return VeroError.builder(ErrorCode.UNKNOWN_TOKEN)
            .location(ErrorLocation.at(line, column))
            .whatWentWrong("Unknown token: '" + text + "'")
            .howToFix("Environment references look like {{NAME}} with a letter or underscore first.")
            .build();
    }

    public static VeroError unterminatedReference(int line, int column) {
        return VeroError.builder(ErrorCode.UNTERMINATED_REFERENCE)
            .location(ErrorLocation.at(line, column))
            .whatWentWrong("Unterminated environment variable reference")
            .howToFix("Close the reference with '}}' on the same line.")
            .build();
    }
}

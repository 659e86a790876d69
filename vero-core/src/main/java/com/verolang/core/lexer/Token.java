package com.verolang.core.lexer;

import java.util.Objects;

/**
 * A lexical token.
 *
 * @param type token kind
 * @param value source text (unescaped content for strings, name for env references)
 * @param line 1-based line
 * @param column 1-based column of the first character
 */
public record Token(TokenType type, String value, int line, int column) {

    public Token {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * Text used in diagnostics to describe what was found.
     */
    public String describe() {
        return switch (type) {
            case EOF -> "end of file";
            case STRING -> "\"" + value + "\"";
            case ENV_VAR -> "{{" + value + "}}";
            default -> value;
        };
    }
}

package com.verolang.core.lexer;

import com.verolang.core.error.VeroError;

import java.util.List;
import java.util.Objects;

/**
 * Output of {@link Lexer#tokenize(String)}.
 *
 * @param tokens token stream, always ending with {@link TokenType#EOF}
 * @param errors non-fatal lexical errors in source order
 */
public record LexResult(List<Token> tokens, List<VeroError> errors) {

    public LexResult {
        Objects.requireNonNull(tokens, "tokens must not be null");
        tokens = List.copyOf(tokens);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}

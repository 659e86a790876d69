package com.verolang.core.parser;

import com.verolang.core.ast.Program;
import com.verolang.core.error.VeroError;

import java.util.List;
import java.util.Objects;

/**
 * Output of {@link Parser#parse(List)}.
 *
 * @param program declarations that parsed; failed declarations are left out
 * @param errors syntax errors in source order
 */
public record ParseResult(Program program, List<VeroError> errors) {

    public ParseResult {
        Objects.requireNonNull(program, "program must not be null");
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}

package com.verolang.cli;

import com.verolang.core.ast.Program;
import com.verolang.core.error.VeroError;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * One Vero source file after lexing and parsing.
 *
 * @param path absolute path
 * @param relativePath path relative to the project root, with forward slashes
 * @param source file content
 * @param program parsed program; empty when the file has lexer errors
 * @param syntaxErrors lexer or parser errors
 */
public record SourceUnit(Path path, String relativePath, String source, Program program, List<VeroError> syntaxErrors) {

    public SourceUnit {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(program, "program must not be null");
        syntaxErrors = syntaxErrors == null ? List.of() : List.copyOf(syntaxErrors);
    }

    public boolean hasSyntaxErrors() {
        return !syntaxErrors.isEmpty();
    }

    /**
     * Whether the file declares features, and so produces a script.
     */
    public boolean hasFeatures() {
        return !program.features().isEmpty();
    }
}

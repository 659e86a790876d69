package com.verolang.core;

import com.verolang.core.ast.Program;
import com.verolang.core.lexer.LexResult;
import com.verolang.core.lexer.Lexer;
import com.verolang.core.parser.ParseResult;
import com.verolang.core.parser.Parser;
import com.verolang.core.transpiler.TranspileOptions;
import com.verolang.core.transpiler.TranspileResult;
import com.verolang.core.transpiler.Transpiler;
import com.verolang.core.validator.ValidationContext;
import com.verolang.core.validator.ValidationResult;
import com.verolang.core.validator.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Entry point to the Vero pipeline: source text to Playwright script.
 *
 * <p>Each stage is also exposed on its own. {@link #compile(String, CompileOptions)} stops at the
 * first stage that reports errors: lexer and parser errors leave no usable program, and
 * validation errors block code generation. Warnings never stop the pipeline.
 *
 * <p>Stateless; safe to call from several threads at once.
 */
public final class VeroCompiler {

    private static final Logger log = LoggerFactory.getLogger(VeroCompiler.class);

    private VeroCompiler() {
        // Utility class
    }

    public static LexResult tokenize(String source) {
        return Lexer.tokenize(source);
    }

    /**
     * Tokenizes and parses {@code source}. Lexer errors are returned without parsing.
     */
    public static ParseResult parse(String source) {
        LexResult lexed = Lexer.tokenize(source);
        if (lexed.hasErrors()) {
            return new ParseResult(Program.empty(), lexed.errors());
        }
        return Parser.parse(lexed.tokens());
    }

    public static ValidationResult validate(Program program, ValidationContext context) {
        return Validator.validate(program, context);
    }

    public static TranspileResult transpile(Program program, TranspileOptions options) {
        return Transpiler.transpile(program, options);
    }

    public static CompileResult compile(String source) {
        return compile(source, CompileOptions.defaults());
    }

    /**
     * Runs the whole pipeline.
     *
     * @param source Vero source text
     * @param options context declarations and transpiler settings
     * @return generated code, or the diagnostics of the stage that failed
     * @throws com.verolang.core.selection.ScenarioSelectionException when the selection is malformed
     */
    public static CompileResult compile(String source, CompileOptions options) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(options, "options must not be null");

        LexResult lexed = Lexer.tokenize(source);
        if (lexed.hasErrors()) {
            log.debug("Compile stopped after lexing: {} errors", lexed.errors().size());
            return CompileResult.failure(CompileResult.Stage.LEX, lexed.errors(), List.of());
        }

        ParseResult parsed = Parser.parse(lexed.tokens());
        if (parsed.hasErrors()) {
            log.debug("Compile stopped after parsing: {} errors", parsed.errors().size());
            return CompileResult.failure(CompileResult.Stage.PARSE, parsed.errors(), List.of());
        }

        ValidationContext context = options.context();
        ValidationResult validation = Validator.validate(parsed.program(), context);
        if (!validation.valid()) {
            log.debug("Compile stopped after validation: {} errors", validation.errors().size());
            return CompileResult.failure(CompileResult.Stage.VALIDATE, validation.errors(), validation.warnings());
        }

        Program program = parsed.program().withContext(context.pages(), context.pageActions());
        TranspileResult result = Transpiler.transpile(program, options.transpile());
        return CompileResult.success(result, validation.warnings());
    }
}

package com.verolang.cli;

import com.verolang.core.VeroCompiler;
import com.verolang.core.ast.Program;
import com.verolang.core.config.ConfigLoader;
import com.verolang.core.lexer.LexResult;
import com.verolang.core.parser.ParseResult;
import com.verolang.core.validator.ValidationContext;
import com.verolang.core.validator.ValidationResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Dumps one pipeline stage of a single file as JSON, for debugging the compiler.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * vero inspect features/Login.vero --stage tokens
 * vero inspect features/Login.vero --stage validation --project .
 * }</pre>
 */
@Command(
    name = "inspect",
    description = "Print tokens, syntax tree or validation result of a file as JSON",
    mixinStandardHelpOptions = true
)
public class InspectCommand implements Callable<Integer> {

    enum Stage { TOKENS, AST, VALIDATION }

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Vero source file")
    private Path file;

    @Option(names = "--stage", description = "Stage to print: ${COMPLETION-CANDIDATES} (default: ast)",
        defaultValue = "AST")
    private Stage stage;

    @Option(names = "--project", description = "Project whose other files provide pages for validation")
    private Path project;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("✗ Cannot read " + file + ": " + e.getMessage());
            return 1;
        }

        switch (stage) {
            case TOKENS -> {
                LexResult lexed = VeroCompiler.tokenize(source);
                out.println(DiagnosticPrinter.toJson(lexed));
                return lexed.hasErrors() ? 1 : 0;
            }
            case AST -> {
                ParseResult parsed = VeroCompiler.parse(source);
                out.println(DiagnosticPrinter.toJson(parsed));
                return parsed.hasErrors() ? 1 : 0;
            }
            default -> {
                ParseResult parsed = VeroCompiler.parse(source);
                if (parsed.hasErrors()) {
                    out.println(DiagnosticPrinter.toJson(parsed.errors()));
                    return 1;
                }
                ValidationResult result = VeroCompiler.validate(parsed.program(), context());
                out.println(DiagnosticPrinter.toJson(result));
                return result.valid() ? 0 : 1;
            }
        }
    }

    private ValidationContext context() {
        if (project == null) {
            return ValidationContext.empty();
        }
        ProjectSources sources = ProjectSources.load(project, ConfigLoader.loadFromProject(project));
        Path self = file.toAbsolutePath().normalize();
        List<Program> others = new ArrayList<>();
        for (SourceUnit unit : sources.units()) {
            if (!unit.path().equals(self) && !unit.hasSyntaxErrors()) {
                others.add(unit.program());
            }
        }
        return ValidationContext.of(others);
    }
}

package com.verolang.cli;

import com.verolang.core.VeroCompiler;
import com.verolang.core.config.ConfigLoader;
import com.verolang.core.config.VeroConfig;
import com.verolang.core.error.VeroError;
import com.verolang.core.validator.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to validate Vero sources without generating any code.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * vero check
 * vero check features/Login.vero --format json
 * }</pre>
 */
@Command(
    name = "check",
    description = "Report syntax and validation diagnostics",
    mixinStandardHelpOptions = true
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    enum Format { TEXT, JSON }

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Project directory or source file (default: current directory)",
        defaultValue = ".")
    private Path projectPath;

    @Option(names = "--format", description = "Output format: ${COMPLETION-CANDIDATES} (default: text)",
        defaultValue = "TEXT")
    private Format format;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            Path absolute = projectPath.toAbsolutePath().normalize();
            Path root = Files.isRegularFile(absolute) ? absolute.getParent() : absolute;
            VeroConfig config = ConfigLoader.loadFromProject(root);
            ProjectSources sources = ProjectSources.load(projectPath, config);

            Map<String, List<VeroError>> byFile = new LinkedHashMap<>();
            for (SourceUnit unit : sources.units()) {
                List<VeroError> diagnostics = new ArrayList<>(unit.syntaxErrors());
                if (!unit.hasSyntaxErrors()) {
                    ValidationResult result = VeroCompiler.validate(unit.program(), sources.contextFor(unit));
                    diagnostics.addAll(result.all());
                }
                byFile.put(unit.relativePath(), diagnostics);
            }

            long errors = byFile.values().stream().flatMap(List::stream).filter(VeroError::isError).count();
            long warnings = byFile.values().stream().flatMap(List::stream).filter(e -> !e.isError()).count();
            log.debug("Checked {} files: {} errors, {} warnings", byFile.size(), errors, warnings);

            if (format == Format.JSON) {
                DiagnosticPrinter.printJson(out, byFile);
            } else {
                byFile.forEach((file, diagnostics) -> DiagnosticPrinter.printText(out, file, diagnostics));
                String summary = byFile.size() + " files, " + errors + " errors, " + warnings + " warnings";
                out.println(errors == 0 ? "✓ " + summary : "✗ " + summary);
            }
            return errors == 0 ? 0 : 1;
        } catch (IllegalStateException e) {
            log.error("Check failed", e);
            err.println("✗ Check failed: " + e.getMessage());
            return 1;
        }
    }
}

package com.verolang.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.verolang.core.VeroCompiler;
import com.verolang.core.config.ConfigLoader;
import com.verolang.core.config.VeroConfig;
import com.verolang.core.renderer.GeneratedFile;
import com.verolang.core.renderer.GeneratedOutput;
import com.verolang.core.renderer.OutputRenderer;
import com.verolang.core.renderer.RenderContext;
import com.verolang.core.renderer.impl.ConsoleRenderer;
import com.verolang.core.renderer.impl.FileSystemRenderer;
import com.verolang.core.selection.ScenarioSelection;
import com.verolang.core.selection.ScenarioSelectionException;
import com.verolang.core.selection.TagMode;
import com.verolang.core.transpiler.ParamCombination;
import com.verolang.core.transpiler.TranspileOptions;
import com.verolang.core.transpiler.TranspileResult;
import com.verolang.core.util.FileUtils;
import com.verolang.core.validator.ValidationContext;
import com.verolang.core.validator.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to compile a Vero project into Playwright Test scripts.
 *
 * <p>Orchestrates the pipeline for every source file:
 * <ol>
 *   <li>Load configuration and parse all sources</li>
 *   <li>Validate each file against the declarations of the others</li>
 *   <li>Transpile each file that declares features, applying the scenario selection</li>
 *   <li>Render the scripts to the output directory or standard output</li>
 * </ol>
 *
 * <p>Exit codes: {@code 0} success, {@code 1} diagnostics errors or I/O failure, {@code 2} a
 * selection was given and matched no scenario.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * vero compile
 * vero compile shop-tests -o build/e2e
 * vero compile --tag smoke --exclude-tag slow
 * vero compile --tags "@checkout and not @flaky" --stdout
 * vero compile --combinations users.json
 * }</pre>
 */
@Command(
    name = "compile",
    description = "Validate and transpile Vero sources to Playwright tests",
    mixinStandardHelpOptions = true
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    static final int EXIT_OK = 0;
    static final int EXIT_ERRORS = 1;
    static final int EXIT_NOTHING_SELECTED = 2;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Project directory or source file (default: current directory)",
        defaultValue = ".")
    private Path projectPath;

    @Option(names = {"-o", "--output"}, description = "Output directory (overrides config)")
    private Path outputDir;

    @Option(names = "--scenario", description = "Scenario name to include (repeatable)")
    private List<String> scenarios = new ArrayList<>();

    @Option(names = "--grep", description = "Regular expression matched against scenario names (repeatable)")
    private List<String> patterns = new ArrayList<>();

    @Option(names = "--tag", description = "Tag to include (repeatable)")
    private List<String> tags = new ArrayList<>();

    @Option(names = "--exclude-tag", description = "Tag to exclude (repeatable)")
    private List<String> excludeTags = new ArrayList<>();

    @Option(names = "--tag-mode", description = "How --tag values combine: any or all (default: any)",
        defaultValue = "any")
    private String tagMode;

    @Option(names = "--tags", description = "Tag expression, e.g. \"@smoke and not @slow\"")
    private String tagExpression;

    @Option(names = "--combinations", description = "JSON file with parameter combinations")
    private Path combinationsFile;

    @Option(names = "--stdout", description = "Print scripts instead of writing files")
    private boolean stdout;

    @Override
    public Integer call() {
        PrintWriter status = stdout ? spec.commandLine().getErr() : spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            Path root = projectRoot();
            VeroConfig config = ConfigLoader.loadFromProject(root);
            TranspileOptions options = config.transpiler().toOptions()
                .withSelection(selection())
                .withCombinations(loadCombinations());

            ProjectSources sources = ProjectSources.load(projectPath, config);
            if (sources.units().isEmpty()) {
                err.println("✗ No ." + config.sources().extension() + " files found under " + projectPath);
                return EXIT_ERRORS;
            }

            List<GeneratedFile> files = new ArrayList<>();
            boolean failed = false;
            int total = 0;
            int selected = 0;
            for (SourceUnit unit : sources.units()) {
                if (unit.hasSyntaxErrors()) {
                    DiagnosticPrinter.printText(err, unit.relativePath(), unit.syntaxErrors());
                    failed = true;
                    continue;
                }
                ValidationContext context = sources.contextFor(unit);
                ValidationResult validation = VeroCompiler.validate(unit.program(), context);
                DiagnosticPrinter.printText(err, unit.relativePath(), validation.all());
                if (!validation.valid()) {
                    failed = true;
                    continue;
                }
                if (failed || !unit.hasFeatures()) {
                    continue;
                }

                TranspileResult result = VeroCompiler.transpile(
                    unit.program().withContext(context.pages(), context.pageActions()), options);
                total += result.totalScenarios();
                selected += result.selectedScenarios();
                if (result.selectedScenarios() > 0 || !options.selection().hasFilters()) {
                    files.add(GeneratedFile.typescript(
                        outputPath(unit.relativePath(), config.output().fileSuffix()), result.code()));
                }
            }

            if (failed) {
                err.println("✗ Compilation failed");
                return EXIT_ERRORS;
            }
            if (options.selection().hasFilters() && selected == 0) {
                err.println("✗ Selection matched none of " + total + " scenarios");
                return EXIT_NOTHING_SELECTED;
            }

            render(new GeneratedOutput(files), root, config);
            status.println("✓ Compiled " + selected + " of " + total + " scenarios into " + files.size() + " files");
            return EXIT_OK;
        } catch (ScenarioSelectionException e) {
            err.println("✗ Invalid selection: " + e.getMessage());
            return EXIT_ERRORS;
        } catch (IllegalStateException e) {
            log.error("Compile failed", e);
            err.println("✗ Compile failed: " + e.getMessage());
            return EXIT_ERRORS;
        }
    }

    private Path projectRoot() {
        Path absolute = projectPath.toAbsolutePath().normalize();
        return Files.isRegularFile(absolute) ? absolute.getParent() : absolute;
    }

    ScenarioSelection selection() {
        return new ScenarioSelection(scenarios, patterns, tags, excludeTags, TagMode.fromId(tagMode), tagExpression);
    }

    private List<ParamCombination> loadCombinations() {
        if (combinationsFile == null) {
            return List.of();
        }
        try {
            List<ParamCombination> combinations = JSON.readValue(combinationsFile.toFile(),
                new TypeReference<List<ParamCombination>>() { });
            log.debug("Loaded {} parameter combinations from {}", combinations.size(), combinationsFile);
            return combinations;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read combinations from " + combinationsFile, e);
        }
    }

    private void render(GeneratedOutput output, Path root, VeroConfig config) {
        if (stdout) {
            Map<String, String> settings = Map.of(
                "console.colors", "false",
                "console.showHeaders", Boolean.toString(output.files().size() > 1));
            new ConsoleRenderer(spec.commandLine().getOut()).render(output, new RenderContext(".", settings));
            return;
        }
        Path target = outputDir != null ? outputDir : root.resolve(config.output().directory());
        OutputRenderer renderer = OutputRenderer.find("filesystem").orElseGet(FileSystemRenderer::new);
        renderer.render(output, RenderContext.of(target.toString()));
    }

    /**
     * {@code features/Login.vero} with suffix {@code .spec.ts} becomes {@code features/Login.spec.ts}.
     */
    static String outputPath(String relativePath, String suffix) {
        Path relative = Paths.get(relativePath);
        String name = FileUtils.withExtension(relative, suffix.startsWith(".") ? suffix.substring(1) : suffix);
        Path parent = relative.getParent();
        return parent == null ? name : parent.resolve(name).toString().replace('\\', '/');
    }
}

package com.verolang.cli;

import com.verolang.core.config.ConfigLoader;
import com.verolang.core.config.VeroConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to create a starter Vero project.
 *
 * <p>Writes {@code vero.yaml}, an example page and an example feature that compile as-is.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * vero init
 * vero init shop-tests
 * vero init shop-tests --force
 * }</pre>
 */
@Command(
    name = "init",
    description = "Create vero.yaml and example sources",
    mixinStandardHelpOptions = true
)
public class InitCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InitCommand.class);

    static final String EXAMPLE_PAGE = "pages/ExamplePage.vero";
    static final String EXAMPLE_FEATURE = "features/Example.vero";

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Project directory (default: current directory)", defaultValue = ".")
    private Path projectPath;

    @Option(names = {"-f", "--force"}, description = "Overwrite an existing vero.yaml")
    private boolean force;

    @Override
    public Integer call() {
        Path root = projectPath.toAbsolutePath().normalize();
        Path configPath = root.resolve(VeroConfig.FILE_NAME);
        if (Files.exists(configPath) && !force) {
            spec.commandLine().getErr().println("✗ " + configPath + " already exists. Use --force to overwrite.");
            return 1;
        }

        try {
            VeroConfig defaults = VeroConfig.defaults();
            String name = root.getFileName() == null ? defaults.project().name() : root.getFileName().toString();
            VeroConfig config = new VeroConfig(
                new VeroConfig.ProjectInfo(name, defaults.project().version(), null),
                defaults.sources(), defaults.output(), defaults.transpiler());
            ConfigLoader.write(config, configPath);

            writeTemplate(root, EXAMPLE_PAGE, "ExamplePage.vero");
            writeTemplate(root, EXAMPLE_FEATURE, "Example.vero");
        } catch (IllegalStateException e) {
            log.error("Init failed", e);
            spec.commandLine().getErr().println("✗ Init failed: " + e.getMessage());
            return 1;
        }

        spec.commandLine().getOut().println("✓ Created Vero project in " + root);
        return 0;
    }

    private void writeTemplate(Path root, String relativePath, String template) {
        Path target = root.resolve(relativePath);
        if (Files.exists(target) && !force) {
            log.info("Keeping existing file: {}", target);
            return;
        }
        try (InputStream in = InitCommand.class.getResourceAsStream("templates/" + template)) {
            if (in == null) {
                throw new IllegalStateException("Template not found: " + template);
            }
            Files.createDirectories(target.getParent());
            Files.writeString(target, new String(in.readAllBytes(), StandardCharsets.UTF_8), StandardCharsets.UTF_8);
            log.info("Wrote {}", target);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write " + target, e);
        }
    }
}

package com.verolang;

import ch.qos.logback.classic.Level;
import com.verolang.cli.CheckCommand;
import com.verolang.cli.CompileCommand;
import com.verolang.cli.InitCommand;
import com.verolang.cli.InspectCommand;
import com.verolang.cli.ListCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;

/**
 * Main CLI entry point for Vero.
 *
 * <p>Vero compiles UI test scenarios written in the Vero language into Playwright Test scripts.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code init} - Create a starter project</li>
 *   <li>{@code compile} - Validate and transpile a project to Playwright scripts</li>
 *   <li>{@code check} - Report diagnostics without generating code</li>
 *   <li>{@code inspect} - Print tokens, AST or validation result of one file as JSON</li>
 *   <li>{@code list} - List error codes or renderers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * vero init shop-tests
 * vero check shop-tests
 * vero compile shop-tests --tag smoke
 * vero -v compile shop-tests --stdout
 * }</pre>
 */
@Command(
    name = "vero",
    mixinStandardHelpOptions = true,
    version = "Vero 1.0.0-SNAPSHOT",
    description = "Compiler for the Vero UI test language",
    subcommands = {
        InitCommand.class,
        CompileCommand.class,
        CheckCommand.class,
        InspectCommand.class,
        ListCommand.class
    }
)
public class VeroCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(VeroCLI.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        PrintWriter out = spec.commandLine().getOut();
        out.println("Vero - UI test language compiler");
        out.println("Version: 1.0.0-SNAPSHOT");
        out.println();
        out.println("Use 'vero --help' to see available commands");
        out.println("Use 'vero <command> --help' for command-specific help");
    }

    /**
     * Sets the root log level from the global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line. Global options are applied before the chosen subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        VeroCLI cli = new VeroCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}

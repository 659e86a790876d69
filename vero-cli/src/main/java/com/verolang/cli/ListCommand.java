package com.verolang.cli;

import com.verolang.core.error.ErrorCategory;
import com.verolang.core.error.ErrorCode;
import com.verolang.core.renderer.OutputRenderer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Lists the error catalog and the available output renderers.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * vero list codes
 * vero list codes --category locator
 * vero list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List error codes or output renderers",
    mixinStandardHelpOptions = true,
    subcommands = {ListCommand.Codes.class, ListCommand.Renderers.class}
)
public class ListCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    @Command(name = "codes", description = "List error codes", mixinStandardHelpOptions = true)
    static class Codes implements Callable<Integer> {

        @Spec
        private CommandSpec spec;

        @Option(names = "--category", description = "Only codes of this category, e.g. locator")
        private String category;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            List<ErrorCode> codes;
            if (category == null) {
                codes = Arrays.asList(ErrorCode.values());
            } else {
                try {
                    codes = ErrorCode.byCategory(ErrorCategory.fromId(category));
                } catch (IllegalArgumentException e) {
                    spec.commandLine().getErr().println("✗ " + e.getMessage());
                    return 1;
                }
            }
            for (ErrorCode code : codes) {
                out.printf("%-8s %-11s %-8s %s%n", code.code(), code.category().id(),
                    code.defaultSeverity().name().toLowerCase(Locale.ROOT), code.title());
            }
            return 0;
        }
    }

    @Command(name = "renderers", description = "List output renderers", mixinStandardHelpOptions = true)
    static class Renderers implements Callable<Integer> {

        @Spec
        private CommandSpec spec;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
                out.println(renderer.getId() + "  " + renderer.getClass().getName());
            }
            return 0;
        }
    }
}

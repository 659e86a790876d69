package com.verolang.core.renderer.impl;

import com.verolang.core.renderer.GeneratedFile;
import com.verolang.core.renderer.GeneratedOutput;
import com.verolang.core.renderer.OutputRenderer;
import com.verolang.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;

/**
 * Prints generated scripts to standard output.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - ANSI colors in headers ("true"/"false", default: "true")</li>
 *   <li>{@code console.showHeaders} - file headers ("true"/"false", default: "true")</li>
 * </ul>
 *
 * <p>With headers off and a single file the output is exactly the script, so it can be piped
 * straight into a file.
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private final PrintWriter out;

    public ConsoleRenderer() {
        this(new PrintWriter(System.out, true));
    }

    public ConsoleRenderer(PrintWriter out) {
        this.out = out;
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean useColors = Boolean.parseBoolean(context.getSettingOrDefault("console.colors", "true"));
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault("console.showHeaders", "true"));
        logger.debug("Rendering {} files to console (colors: {}, headers: {})",
            output.files().size(), useColors, showHeaders);

        int total = output.files().size();
        for (int i = 0; i < total; i++) {
            GeneratedFile file = output.files().get(i);
            if (showHeaders) {
                printFileHeader(file, i + 1, total, useColors);
            }
            out.print(file.content());
            if (showHeaders && i < total - 1) {
                out.println();
            }
        }
        out.flush();
    }

    private void printFileHeader(GeneratedFile file, int index, int total, boolean useColors) {
        String pathColor = useColors ? ANSI_BOLD + ANSI_CYAN : "";
        String lineColor = useColors ? ANSI_YELLOW : "";
        String reset = useColors ? ANSI_RESET : "";

        out.println(lineColor + "// " + "-".repeat(77) + reset);
        out.println(pathColor + "// File " + index + "/" + total + ": " + file.relativePath() + reset);
        out.println(lineColor + "// " + "-".repeat(77) + reset);
    }
}

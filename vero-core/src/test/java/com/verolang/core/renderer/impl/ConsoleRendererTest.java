package com.verolang.core.renderer.impl;

import com.verolang.core.renderer.GeneratedFile;
import com.verolang.core.renderer.GeneratedOutput;
import com.verolang.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest {

    private StringWriter buffer;
    private ConsoleRenderer renderer;

    @BeforeEach
    void setUp() {
        buffer = new StringWriter();
        renderer = new ConsoleRenderer(new PrintWriter(buffer));
    }

    @Test
    void getId_returnsConsole() {
        assertThat(renderer.getId()).isEqualTo("console");
    }

    @Test
    void render_withoutHeaders_printsExactlyTheScript() {
        String script = "import { test } from '@playwright/test';\n";
        RenderContext context = new RenderContext("-", Map.of("console.showHeaders", "false"));

        renderer.render(new GeneratedOutput(List.of(GeneratedFile.typescript("Login.spec.ts", script))), context);

        assertThat(buffer.toString()).isEqualTo(script);
    }

    @Test
    void render_withHeadersAndNoColors_numbersEachFile() {
        GeneratedOutput output = new GeneratedOutput(List.of(
            GeneratedFile.typescript("A.spec.ts", "// a\n"),
            GeneratedFile.typescript("B.spec.ts", "// b\n")));
        RenderContext context = new RenderContext("-", Map.of("console.colors", "false"));

        renderer.render(output, context);

        String printed = buffer.toString();
        assertThat(printed)
            .contains("// File 1/2: A.spec.ts")
            .contains("// File 2/2: B.spec.ts")
            .contains("// a")
            .contains("// b")
            .doesNotContain("\u001B[");
        assertThat(printed.indexOf("A.spec.ts")).isLessThan(printed.indexOf("B.spec.ts"));
    }

    @Test
    void render_withColors_usesAnsiCodes() {
        renderer.render(new GeneratedOutput(List.of(GeneratedFile.typescript("A.spec.ts", ""))),
            RenderContext.of("-"));

        assertThat(buffer.toString()).contains("\u001B[36m");
    }

    @Test
    void render_emptyOutput_printsNothing() {
        renderer.render(new GeneratedOutput(List.of()), RenderContext.of("-"));

        assertThat(buffer.toString()).isEmpty();
    }
}

package com.verolang.core.renderer.impl;

import com.verolang.core.renderer.GeneratedFile;
import com.verolang.core.renderer.GeneratedOutput;
import com.verolang.core.renderer.OutputRenderer;
import com.verolang.core.renderer.RenderContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    @TempDir
    Path tempDir;

    private final FileSystemRenderer renderer = new FileSystemRenderer();

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_writesFilesCreatingDirectories() throws IOException {
        GeneratedOutput output = new GeneratedOutput(List.of(
            GeneratedFile.typescript("features/Login.spec.ts", "test('a', async () => {});\n"),
            GeneratedFile.typescript("Cart.spec.ts", "// cart\n")));
        Path outDir = tempDir.resolve("generated");

        renderer.render(output, RenderContext.of(outDir.toString()));

        assertThat(Files.readString(outDir.resolve("features/Login.spec.ts"))).isEqualTo("test('a', async () => {});\n");
        assertThat(Files.readString(outDir.resolve("Cart.spec.ts"))).isEqualTo("// cart\n");
    }

    @Test
    void render_overwritesExistingFile() throws IOException {
        Path existing = tempDir.resolve("Login.spec.ts");
        Files.writeString(existing, "old");

        renderer.render(new GeneratedOutput(List.of(GeneratedFile.typescript("Login.spec.ts", "new"))),
            RenderContext.of(tempDir.toString()));

        assertThat(Files.readString(existing)).isEqualTo("new");
    }

    @Test
    void render_pathEscapingOutputDirectory_throws() {
        GeneratedOutput output = new GeneratedOutput(List.of(GeneratedFile.typescript("../escape.ts", "")));

        assertThatThrownBy(() -> renderer.render(output, RenderContext.of(tempDir.resolve("out").toString())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("outside the output directory");
        assertThat(tempDir.resolve("escape.ts")).doesNotExist();
    }

    @Test
    void find_discoversBuiltInRenderers() {
        assertThat(OutputRenderer.find("filesystem")).get().isInstanceOf(FileSystemRenderer.class);
        assertThat(OutputRenderer.find("console")).get().isInstanceOf(ConsoleRenderer.class);
        assertThat(OutputRenderer.find("s3")).isEmpty();
    }
}

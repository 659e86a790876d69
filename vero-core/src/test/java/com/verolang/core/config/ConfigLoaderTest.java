package com.verolang.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("vero.yaml");
        Files.writeString(configFile, """
            project:
              name: "checkout-tests"
              version: "2.1.0"
              description: "Checkout flows"

            sources:
              directories:
                - pages
                - flows
              extension: .vero

            output:
              directory: "build/playwright"
              fileSuffix: ".test.ts"

            transpiler:
              baseUrl: "https://shop.example.com"
              indent: 4
            """);

        VeroConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("checkout-tests");
        assertThat(config.project().version()).isEqualTo("2.1.0");
        assertThat(config.project().description()).isEqualTo("Checkout flows");
        assertThat(config.sources().directories()).containsExactly("pages", "flows");
        assertThat(config.sources().extension()).isEqualTo("vero");
        assertThat(config.sources().glob()).isEqualTo("**/*.vero");
        assertThat(config.output().directory()).isEqualTo("build/playwright");
        assertThat(config.output().fileSuffix()).isEqualTo(".test.ts");
        assertThat(config.transpiler().toOptions().baseUrl()).isEqualTo("https://shop.example.com");
        assertThat(config.transpiler().toOptions().indent()).isEqualTo(4);
    }

    @Test
    void load_minimalYaml_fillsMissingSectionsWithDefaults() throws IOException {
        Path configFile = tempDir.resolve("vero.yaml");
        Files.writeString(configFile, """
            project:
              name: "minimal"
              version: "1.0.0"
            unknownSection:
              ignored: true
            """);

        VeroConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("minimal");
        assertThat(config.project().description()).isNull();
        assertThat(config.sources()).isEqualTo(VeroConfig.defaults().sources());
        assertThat(config.output().directory()).isEqualTo("generated");
        assertThat(config.transpiler().indent()).isEqualTo(2);
    }

    @Test
    void load_outOfRangeIndent_fallsBackToDefault() throws IOException {
        Path configFile = tempDir.resolve("vero.yaml");
        Files.writeString(configFile, """
            transpiler:
              indent: 12
            """);

        assertThat(ConfigLoader.load(configFile).transpiler().indent()).isEqualTo(2);
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        VeroConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(VeroConfig.defaults());
        assertThat(config.sources().directories()).containsExactly("pages", "features");
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("vero.yaml");
        Files.writeString(configFile, "project: [unclosed");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(VeroConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = Files.writeString(tempDir.resolve("vero.yaml"), "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(VeroConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(VeroConfig.defaults());
    }

    @Test
    void write_thenLoadFromProject_roundTrips() {
        VeroConfig config = new VeroConfig(
            new VeroConfig.ProjectInfo("shop", "0.3.0", null),
            new VeroConfig.SourcesConfig(List.of("specs"), "vero"),
            new VeroConfig.OutputConfig("out", ".spec.ts"),
            new VeroConfig.TranspilerConfig("http://localhost:8080", 2));

        ConfigLoader.write(config, tempDir.resolve("nested/vero.yaml"));

        assertThat(ConfigLoader.loadFromProject(tempDir.resolve("nested"))).isEqualTo(config);
    }
}

package com.verolang.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CheckCommand}.
 */
class CheckCommandTest {

    @TempDir
    Path tempDir;

    private Path project;

    @BeforeEach
    void initProject() {
        project = tempDir.resolve("shop-tests");
        CliTestSupport.run("init", project.toString());
    }

    @Test
    void check_cleanProject_succeeds() {
        CliTestSupport.Run run = CliTestSupport.run("check", project.toString());

        assertThat(run.exitCode()).isZero();
        assertThat(run.out()).contains("✓ 2 files, 0 errors");
        assertThat(project.resolve("generated")).doesNotExist();
    }

    @Test
    void check_unknownPage_reportsErrorWithSuggestion() throws IOException {
        Files.writeString(project.resolve("features/Typo.vero"), """
            FEATURE Typo {
              USE ExamplePag
              SCENARIO first {
                REFRESH
              }
            }
            """);

        CliTestSupport.Run run = CliTestSupport.run("check", project.toString());

        assertThat(run.exitCode()).isEqualTo(1);
        assertThat(run.out())
            .contains("features/Typo.vero: error [VERO-200]")
            .contains("Did you mean 'ExamplePage'?")
            .contains("✗ 3 files, 1 errors");
    }

    @Test
    void check_jsonFormat_groupsDiagnosticsByFile() throws IOException {
        Files.writeString(project.resolve("features/Broken.vero"), """
            FEATURE Broken {
              SCENARIO first {
                FLY "away"
              }
            }
            """);

        CliTestSupport.Run run = CliTestSupport.run("check", project.toString(), "--format", "json");

        assertThat(run.exitCode()).isEqualTo(1);
        JsonNode json = new ObjectMapper().readTree(run.out());
        assertThat(json.has("pages/ExamplePage.vero")).isTrue();
        JsonNode broken = json.get("features/Broken.vero");
        assertThat(broken.size()).isEqualTo(1);
        assertThat(broken.get(0).get("code").asText()).isEqualTo("VERO-303");
        assertThat(broken.get(0).get("category").asText()).isEqualTo("parser");
        assertThat(broken.get(0).get("location").get("line").asInt()).isEqualTo(3);
    }

    @Test
    void check_singleFile_usesOnlyThatFile() {
        CliTestSupport.Run run = CliTestSupport.run("check",
            project.resolve(InitCommand.EXAMPLE_PAGE).toString());

        assertThat(run.exitCode()).isZero();
        assertThat(run.out()).contains("✓ 1 files, 0 errors");
    }
}

package com.verolang.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CompileCommand}.
 */
class CompileCommandTest {

    @TempDir
    Path tempDir;

    private Path project;

    @BeforeEach
    void initProject() {
        project = tempDir.resolve("shop-tests");
        assertThat(CliTestSupport.run("init", project.toString()).exitCode()).isZero();
    }

    @Test
    void compile_initializedProject_writesScriptPerFeatureFile() throws IOException {
        CliTestSupport.Run run = CliTestSupport.run("compile", project.toString());

        assertThat(run.exitCode()).isEqualTo(CompileCommand.EXIT_OK);
        assertThat(run.out()).contains("✓ Compiled 2 of 2 scenarios into 1 files");

        Path script = project.resolve("generated/features/Example.spec.ts");
        assertThat(script).exists();
        assertThat(project.resolve("generated/pages/ExamplePage.spec.ts")).doesNotExist();
        assertThat(Files.readString(script))
            .startsWith("// Generated by vero. Do not edit.")
            .contains("class ExamplePage {")
            .contains("test.describe('Example', () => {")
            .contains("test('Home page shows the heading @smoke'");
    }

    @Test
    void compile_withOutputOption_overridesConfiguredDirectory() {
        Path out = tempDir.resolve("e2e");

        CliTestSupport.Run run = CliTestSupport.run("compile", project.toString(), "-o", out.toString());

        assertThat(run.exitCode()).isZero();
        assertThat(out.resolve("features/Example.spec.ts")).exists();
    }

    @Test
    void compile_withTag_keepsOnlyMatchingScenarios() throws IOException {
        CliTestSupport.Run run = CliTestSupport.run("compile", project.toString(), "--tag", "smoke");

        assertThat(run.exitCode()).isZero();
        assertThat(run.out()).contains("Compiled 1 of 2 scenarios");
        assertThat(Files.readString(project.resolve("generated/features/Example.spec.ts")))
            .doesNotContain("More information link is visible");
    }

    @Test
    void compile_selectionMatchingNothing_exitsWithTwo() {
        CliTestSupport.Run run = CliTestSupport.run("compile", project.toString(), "--tags", "@nightly");

        assertThat(run.exitCode()).isEqualTo(CompileCommand.EXIT_NOTHING_SELECTED);
        assertThat(run.err()).contains("Selection matched none of 2 scenarios");
        assertThat(project.resolve("generated")).doesNotExist();
    }

    @Test
    void compile_malformedTagExpression_reportsInvalidSelection() {
        CliTestSupport.Run run = CliTestSupport.run("compile", project.toString(), "--tags", "@smoke and");

        assertThat(run.exitCode()).isEqualTo(CompileCommand.EXIT_ERRORS);
        assertThat(run.err()).contains("✗ Invalid selection:");
    }

    @Test
    void compile_toStdout_printsScriptWithoutWritingFiles() {
        CliTestSupport.Run run = CliTestSupport.run("compile", project.toString(), "--stdout");

        assertThat(run.exitCode()).isZero();
        assertThat(run.out()).startsWith("// Generated by vero. Do not edit.");
        assertThat(run.err()).contains("✓ Compiled 2 of 2 scenarios");
        assertThat(project.resolve("generated")).doesNotExist();
    }

    @Test
    void compile_withCombinations_emitsOneTestPerCombination() throws IOException {
        Path combinations = Files.writeString(tempDir.resolve("users.json"), """
            [
              {"label": "admin", "values": {"role": "admin"}},
              {"values": {"role": "guest"}}
            ]
            """);

        CliTestSupport.Run run = CliTestSupport.run("compile", project.toString(), "--stdout",
            "--combinations", combinations.toString());

        assertThat(run.exitCode()).isZero();
        assertThat(run.out())
            .contains("test('Home page shows the heading [admin] @smoke'")
            .contains("test('Home page shows the heading [role=guest] @smoke'");
    }

    @Test
    void compile_syntaxError_failsWithDiagnostics() throws IOException {
        Files.writeString(project.resolve("features/Broken.vero"), """
            FEATURE Broken {
              SCENARIO first {
                FLY "away"
              }
            }
            """);

        CliTestSupport.Run run = CliTestSupport.run("compile", project.toString());

        assertThat(run.exitCode()).isEqualTo(CompileCommand.EXIT_ERRORS);
        assertThat(run.err())
            .contains("features/Broken.vero: error [VERO-303]")
            .contains("✗ Compilation failed");
    }

    @Test
    void compile_emptyDirectory_reportsNoSources() {
        CliTestSupport.Run run = CliTestSupport.run("compile", tempDir.resolve("empty").toString());

        assertThat(run.exitCode()).isEqualTo(CompileCommand.EXIT_ERRORS);
        assertThat(run.err()).contains("No .vero files found");
    }

    @Test
    void outputPath_replacesExtensionAndKeepsDirectories() {
        assertThat(CompileCommand.outputPath("features/Login.vero", ".spec.ts")).isEqualTo("features/Login.spec.ts");
        assertThat(CompileCommand.outputPath("Login.vero", "test.ts")).isEqualTo("Login.test.ts");
    }
}

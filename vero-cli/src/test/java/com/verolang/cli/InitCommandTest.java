package com.verolang.cli;

import com.verolang.core.config.ConfigLoader;
import com.verolang.core.config.VeroConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link InitCommand}.
 */
class InitCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void init_emptyDirectory_writesConfigAndExamples() {
        Path project = tempDir.resolve("shop-tests");

        CliTestSupport.Run run = CliTestSupport.run("init", project.toString());

        assertThat(run.exitCode()).isZero();
        assertThat(run.out()).contains("✓ Created Vero project in");
        assertThat(project.resolve(InitCommand.EXAMPLE_PAGE)).exists();
        assertThat(project.resolve(InitCommand.EXAMPLE_FEATURE)).exists();

        VeroConfig config = ConfigLoader.loadFromProject(project);
        assertThat(config.project().name()).isEqualTo("shop-tests");
        assertThat(config.sources().directories()).containsExactly("pages", "features");
    }

    @Test
    void init_existingConfig_refusesWithoutForce() throws IOException {
        Files.writeString(tempDir.resolve(VeroConfig.FILE_NAME), "project:\n  name: keep\n");

        CliTestSupport.Run run = CliTestSupport.run("init", tempDir.toString());

        assertThat(run.exitCode()).isEqualTo(1);
        assertThat(run.err()).contains("already exists. Use --force to overwrite.");
        assertThat(ConfigLoader.loadFromProject(tempDir).project().name()).isEqualTo("keep");
    }

    @Test
    void init_withForce_overwritesConfigAndExamples() throws IOException {
        Files.writeString(tempDir.resolve(VeroConfig.FILE_NAME), "project:\n  name: keep\n");
        Path page = tempDir.resolve(InitCommand.EXAMPLE_PAGE);
        Files.createDirectories(page.getParent());
        Files.writeString(page, "PAGE ExamplePage {}\n");

        CliTestSupport.Run run = CliTestSupport.run("init", tempDir.toString(), "--force");

        assertThat(run.exitCode()).isZero();
        assertThat(ConfigLoader.loadFromProject(tempDir).project().name()).isEqualTo(tempDir.getFileName().toString());
        assertThat(Files.readString(page)).contains("FIELD heading");
    }
}

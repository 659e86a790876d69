package com.verolang.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void findFiles_withRecursivePattern_returnsSortedMatches() throws IOException {
        Path page = tempDir.resolve("pages/LoginPage.vero");
        Path feature = tempDir.resolve("features/Login.vero");
        Files.createDirectories(page.getParent());
        Files.createDirectories(feature.getParent());
        Files.writeString(page, "PAGE LoginPage {}");
        Files.writeString(feature, "FEATURE Login {}");
        Files.writeString(tempDir.resolve("readme.txt"), "ignored");

        List<Path> files = FileUtils.findFiles(tempDir, "**/*.vero");

        assertThat(files).containsExactly(feature, page);
    }

    @Test
    void findFiles_withFileNamePattern_matchesTopLevelFiles() throws IOException {
        Path top = tempDir.resolve("Main.vero");
        Files.writeString(top, "");

        assertThat(FileUtils.findFiles(tempDir, "*.vero")).containsExactly(top);
    }

    @Test
    void findFiles_withNoMatches_returnsEmptyList() throws IOException {
        assertThat(FileUtils.findFiles(tempDir, "**/*.vero")).isEmpty();
    }

    @Test
    void collectSources_expandsDirectoriesAndKeepsFiles() throws IOException {
        Path dir = tempDir.resolve("features");
        Files.createDirectories(dir);
        Path a = Files.writeString(dir.resolve("A.vero"), "");
        Path b = Files.writeString(dir.resolve("B.vero"), "");
        Files.writeString(dir.resolve("notes.md"), "");
        Path explicit = Files.writeString(tempDir.resolve("Other.txt"), "");

        List<Path> sources = FileUtils.collectSources(List.of(explicit, dir));

        assertThat(sources).containsExactly(explicit, a, b);
    }

    @Test
    void getExtension_handlesDotFilesAndMissingExtension() {
        assertThat(FileUtils.getExtension(Path.of("pages/Login.vero"))).isEqualTo("vero");
        assertThat(FileUtils.getExtension(Path.of("Makefile"))).isEmpty();
        assertThat(FileUtils.getExtension(Path.of(".hidden"))).isEmpty();
    }

    @Test
    void withExtension_replacesLastExtension() {
        assertThat(FileUtils.withExtension(Path.of("features/Login.vero"), "spec.ts")).isEqualTo("Login.spec.ts");
        assertThat(FileUtils.withExtension(Path.of("Login"), "spec.ts")).isEqualTo("Login.spec.ts");
    }
}

package com.verolang.cli;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ListCommand}.
 */
class ListCommandTest {

    @Test
    void listCodes_printsWholeCatalog() {
        CliTestSupport.Run run = CliTestSupport.run("list", "codes");

        assertThat(run.exitCode()).isZero();
        assertThat(run.out())
            .contains("VERO-101")
            .contains("VERO-210")
            .contains("VERO-905");
    }

    @Test
    void listCodes_withCategory_filters() {
        CliTestSupport.Run run = CliTestSupport.run("list", "codes", "--category", "timeout");

        assertThat(run.exitCode()).isZero();
        assertThat(run.out().lines()).hasSize(6).allMatch(line -> line.startsWith("VERO-50"));
    }

    @Test
    void listCodes_unknownCategory_fails() {
        CliTestSupport.Run run = CliTestSupport.run("list", "codes", "--category", "disk");

        assertThat(run.exitCode()).isEqualTo(1);
        assertThat(run.err()).contains("Unknown error category: disk");
    }

    @Test
    void listRenderers_printsBuiltIns() {
        CliTestSupport.Run run = CliTestSupport.run("list", "renderers");

        assertThat(run.out()).contains("filesystem").contains("console");
    }
}

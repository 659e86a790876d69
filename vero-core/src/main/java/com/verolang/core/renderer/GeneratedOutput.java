package com.verolang.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Scripts produced by one compile run.
 *
 * @param files generated files in source order
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }
}

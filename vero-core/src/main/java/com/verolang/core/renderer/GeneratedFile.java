package com.verolang.core.renderer;

import java.util.Objects;

/**
 * A generated script to be rendered.
 *
 * @param relativePath path below the output directory, e.g. {@code features/Login.spec.ts}
 * @param content file content
 * @param contentType content type, e.g. {@code text/typescript}
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    public static final String TYPESCRIPT = "text/typescript";

    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    public static GeneratedFile typescript(String relativePath, String content) {
        return new GeneratedFile(relativePath, content, TYPESCRIPT);
    }
}

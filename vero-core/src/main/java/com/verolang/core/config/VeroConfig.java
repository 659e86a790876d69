package com.verolang.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.verolang.core.transpiler.TranspileOptions;
import com.verolang.core.util.FileUtils;

import java.util.List;

/**
 * Root configuration for Vero projects.
 *
 * <p>Loaded from {@code vero.yaml} in the project root. Sections left out of the file fall back
 * to the values of {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "checkout-tests"
 *   version: "1.0.0"
 *
 * sources:
 *   directories: [pages, features]
 *   extension: vero
 *
 * output:
 *   directory: generated
 *   fileSuffix: .spec.ts
 *
 * transpiler:
 *   baseUrl: "https://shop.example.com"
 *   indent: 2
 * }</pre>
 *
 * @param project project metadata
 * @param sources where Vero sources live
 * @param output where generated scripts go
 * @param transpiler code generation settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VeroConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("sources") SourcesConfig sources,
    @JsonProperty("output") OutputConfig output,
    @JsonProperty("transpiler") TranspilerConfig transpiler
) {
    public static final String FILE_NAME = "vero.yaml";

    public VeroConfig {
        VeroConfig fallback = null;
        if (project == null || sources == null || output == null || transpiler == null) {
            fallback = defaults();
        }
        project = project != null ? project : fallback.project();
        sources = sources != null ? sources : fallback.sources();
        output = output != null ? output : fallback.output();
        transpiler = transpiler != null ? transpiler : fallback.transpiler();
    }

    /**
     * Configuration used when {@code vero.yaml} is missing or unreadable.
     *
     * @return default configuration
     */
    public static VeroConfig defaults() {
        return new VeroConfig(
            new ProjectInfo("vero-project", "1.0.0", null),
            new SourcesConfig(List.of("pages", "features"), FileUtils.VERO_EXTENSION),
            new OutputConfig("generated", ".spec.ts"),
            new TranspilerConfig(null, TranspileOptions.DEFAULT_INDENT)
        );
    }

    /**
     * Project metadata.
     *
     * @param name project name
     * @param version project version
     * @param description optional project description
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("version") String version,
        @JsonProperty("description") String description
    ) {}

    /**
     * Source layout.
     *
     * @param directories directories scanned for sources, relative to the project root
     * @param extension source file extension without the dot
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SourcesConfig(
        @JsonProperty("directories") List<String> directories,
        @JsonProperty("extension") String extension
    ) {
        public SourcesConfig {
            directories = directories == null || directories.isEmpty() ? List.of(".") : List.copyOf(directories);
            if (extension == null || extension.isBlank()) {
                extension = FileUtils.VERO_EXTENSION;
            } else if (extension.startsWith(".")) {
                extension = extension.substring(1);
            }
        }

        /**
         * Glob matching source files, e.g. {@code **}{@code /*.vero}.
         */
        public String glob() {
            return "**/*." + extension;
        }
    }

    /**
     * Output configuration.
     *
     * @param directory output directory, relative to the project root
     * @param fileSuffix appended to each source file's base name
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("fileSuffix") String fileSuffix
    ) {
        public OutputConfig {
            if (directory == null || directory.isBlank()) {
                directory = "generated";
            }
            if (fileSuffix == null || fileSuffix.isBlank()) {
                fileSuffix = ".spec.ts";
            }
        }
    }

    /**
     * Code generation settings.
     *
     * @param baseUrl base URL for relative {@code OPEN} targets, or null
     * @param indent spaces per indentation level, 1 to 8
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TranspilerConfig(
        @JsonProperty("baseUrl") String baseUrl,
        @JsonProperty("indent") Integer indent
    ) {
        public TranspilerConfig {
            if (indent == null || indent < 1 || indent > 8) {
                indent = TranspileOptions.DEFAULT_INDENT;
            }
        }

        public TranspileOptions toOptions() {
            return TranspileOptions.defaults().withBaseUrl(baseUrl).withIndent(indent);
        }
    }
}

package com.verolang.core.renderer;

import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Destination for generated Playwright scripts.
 *
 * <p>Renderers are discovered via the Java Service Provider Interface. The built-in ones write
 * to the filesystem ({@code filesystem}) and to standard output ({@code console}).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.verolang.core.renderer.OutputRenderer}
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer, lowercase (e.g. "filesystem", "console").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders the generated output to the target destination.
     *
     * <p>Implementations should validate required settings and throw
     * {@link IllegalStateException} if configuration is invalid or the destination cannot be
     * written.
     *
     * @param output generated scripts
     * @param context rendering context with output directory and settings
     * @throws IllegalStateException if rendering fails
     */
    void render(GeneratedOutput output, RenderContext context);

    /**
     * Finds a renderer registered under {@code id}.
     *
     * @param id renderer identifier
     * @return the renderer, or empty when none is registered under that id
     */
    static Optional<OutputRenderer> find(String id) {
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (renderer.getId().equals(id)) {
                return Optional.of(renderer);
            }
        }
        return Optional.empty();
    }
}

package com.verolang.core.ast;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Root of a parsed Vero file.
 *
 * @param pages page declarations in source order
 * @param pageActions page action libraries in source order
 * @param features features in source order
 */
public record Program(
    List<Page> pages,
    List<PageActions> pageActions,
    List<Feature> features
) {
    public Program {
        pages = pages == null ? List.of() : List.copyOf(pages);
        pageActions = pageActions == null ? List.of() : List.copyOf(pageActions);
        features = features == null ? List.of() : List.copyOf(features);
    }

    public static Program empty() {
        return new Program(List.of(), List.of(), List.of());
    }

    /**
     * Total number of scenarios across all features.
     */
    public int scenarioCount() {
        return features.stream().mapToInt(feature -> feature.scenarios().size()).sum();
    }

    /**
     * Returns a program that also declares the given sibling pages and libraries.
     *
     * <p>Declarations of this program win over context declarations with the same name. Used to
     * hand a feature file plus the pages it depends on to the transpiler.
     *
     * @param contextPages pages declared in other files
     * @param contextPageActions libraries declared in other files
     * @return merged program; features are this program's features
     */
    public Program withContext(List<Page> contextPages, List<PageActions> contextPageActions) {
        Objects.requireNonNull(contextPages, "contextPages must not be null");
        Objects.requireNonNull(contextPageActions, "contextPageActions must not be null");

        Map<String, Page> mergedPages = new LinkedHashMap<>();
        contextPages.forEach(page -> mergedPages.put(page.name(), page));
        pages.forEach(page -> mergedPages.put(page.name(), page));

        Map<String, PageActions> mergedActions = new LinkedHashMap<>();
        contextPageActions.forEach(library -> mergedActions.put(library.name(), library));
        pageActions.forEach(library -> mergedActions.put(library.name(), library));

        return new Program(new ArrayList<>(mergedPages.values()), new ArrayList<>(mergedActions.values()), features);
    }
}

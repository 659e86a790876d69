package com.verolang.core.validator;

import com.verolang.core.ast.ActionDefinition;
import com.verolang.core.ast.Page;
import com.verolang.core.ast.PageActions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pages and page actions libraries known to one validation run. Later registrations replace
 * earlier ones with the same name.
 */
final class Definitions {

    private final Map<String, Page> pages = new LinkedHashMap<>();
    private final Map<String, PageActions> libraries = new LinkedHashMap<>();

    boolean isDefined(String name) {
        return pages.containsKey(name) || libraries.containsKey(name);
    }

    void register(Page page) {
        libraries.remove(page.name());
        pages.put(page.name(), page);
    }

    void register(PageActions library) {
        pages.remove(library.name());
        libraries.put(library.name(), library);
    }

    Optional<Page> page(String name) {
        return Optional.ofNullable(pages.get(name));
    }

    Optional<PageActions> library(String name) {
        return Optional.ofNullable(libraries.get(name));
    }

    Collection<String> pageNames() {
        return pages.keySet();
    }

    List<String> allNames() {
        List<String> names = new ArrayList<>(pages.keySet());
        names.addAll(libraries.keySet());
        return names;
    }

    /**
     * Actions declared by a page or library, or an empty list for unknown names.
     */
    List<ActionDefinition> actionsOf(String owner) {
        if (pages.containsKey(owner)) {
            return pages.get(owner).actions();
        }
        if (libraries.containsKey(owner)) {
            return libraries.get(owner).actions();
        }
        return List.of();
    }
}

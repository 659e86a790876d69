package com.verolang.core.transpiler;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Names visible while emitting one body: which expression holds each page object, which locals
 * exist, and what element lookups hang off.
 *
 * <p>Blocks get a {@link #child()} so locals declared inside an {@code IF} or loop do not leak.
 */
final class EmitScope {

    private final String pageExpression;
    private final Map<String, String> instances;
    private final String ownerPage;
    private final String ownerLibrary;
    private final boolean classBody;
    private final boolean tabsAllowed;
    private final Set<String> variables;
    private final Set<String> declared;
    private String frameRoot;

    private EmitScope(
        String pageExpression,
        Map<String, String> instances,
        String ownerPage,
        String ownerLibrary,
        boolean classBody,
        boolean tabsAllowed,
        Set<String> variables,
        Set<String> declared,
        String frameRoot
    ) {
        this.pageExpression = pageExpression;
        this.instances = instances;
        this.ownerPage = ownerPage;
        this.ownerLibrary = ownerLibrary;
        this.classBody = classBody;
        this.tabsAllowed = tabsAllowed;
        this.variables = variables;
        this.declared = declared;
        this.frameRoot = frameRoot;
    }

    /**
     * Scope of a test or hook body. {@code instances} maps each used page or library to its local.
     */
    static EmitScope forTest(Map<String, String> instances, boolean tabsAllowed) {
        return new EmitScope("page", new LinkedHashMap<>(instances), null, null, false, tabsAllowed,
            new HashSet<>(), new HashSet<>(), null);
    }

    /**
     * Scope of an action method body.
     *
     * @param instances owner page and, for libraries, the wrapped page, mapped to their
     *     {@code this} expressions
     * @param ownerPage page whose fields bare names resolve to first, or null
     * @param ownerLibrary library whose actions bare calls resolve to first, or null
     * @param parameters action parameters
     */
    static EmitScope forAction(Map<String, String> instances, String ownerPage, String ownerLibrary,
                               List<String> parameters) {
        Set<String> params = new HashSet<>(parameters);
        return new EmitScope("this.page", new LinkedHashMap<>(instances), ownerPage, ownerLibrary, true, false,
            params, new HashSet<>(params), null);
    }

    EmitScope child() {
        return new EmitScope(pageExpression, instances, ownerPage, ownerLibrary, classBody, tabsAllowed,
            new HashSet<>(variables), new HashSet<>(declared), frameRoot);
    }

    String page() {
        return pageExpression;
    }

    /**
     * Where element lookups start: the current frame, or the page.
     */
    String root() {
        return frameRoot != null ? frameRoot : pageExpression;
    }

    void enterFrame(String frameLocal) {
        this.frameRoot = frameLocal;
    }

    void leaveFrame() {
        this.frameRoot = null;
    }

    String instance(String name) {
        return instances.get(name);
    }

    Collection<Map.Entry<String, String>> instances() {
        return instances.entrySet();
    }

    String ownerPage() {
        return ownerPage;
    }

    String ownerLibrary() {
        return ownerLibrary;
    }

    /**
     * Whether pages and libraries outside {@link #instances()} may be constructed on the fly.
     */
    boolean isClassBody() {
        return classBody;
    }

    boolean tabsAllowed() {
        return tabsAllowed;
    }

    boolean isVariable(String name) {
        return variables.contains(name);
    }

    /**
     * Registers a local and returns the keyword its first assignment needs: {@code "let "} the
     * first time, nothing afterwards.
     */
    String declare(String name) {
        variables.add(name);
        return declared.add(name) ? "let " : "";
    }

    void bind(String name) {
        variables.add(name);
        declared.add(name);
    }
}

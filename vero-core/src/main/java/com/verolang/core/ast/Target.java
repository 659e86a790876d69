package com.verolang.core.ast;

/**
 * What a statement acts on: a page field ({@code LoginPage.submit}), a bare field name
 * ({@code submit}) or an inline selector ({@code "Sign in"}, {@code BUTTON "Save"}).
 *
 * <p>Exactly one of {@code field} and {@code selector} is set.
 *
 * @param page page name or scope variable before the dot, or null
 * @param field field name, or null for inline selectors
 * @param selector inline selector, or null for field references
 */
public record Target(String page, String field, Selector selector) {

    public Target {
        if ((field == null) == (selector == null)) {
            throw new IllegalArgumentException("Target needs either a field or a selector");
        }
    }

    public static Target of(Selector selector) {
        return new Target(null, null, selector);
    }

    public static Target field(String page, String field) {
        return new Target(page, field, null);
    }

    public boolean hasSelector() {
        return selector != null;
    }

    /**
     * Source-like rendering used in diagnostics.
     */
    public String describe() {
        if (selector != null) {
            return selector.type() == SelectorType.AUTO
                ? "\"" + selector.value() + "\""
                : selector.type().name() + " \"" + selector.value() + "\"";
        }
        return page == null ? field : page + "." + field;
    }
}

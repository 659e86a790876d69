package com.verolang.core.transpiler;

import com.verolang.core.ast.Selector;

import java.util.regex.Pattern;

/**
 * Turns selectors into Playwright locator expressions.
 */
final class Locators {

    private static final Pattern PSEUDO_CLASS = Pattern.compile("(?i):[a-z-]+(\\(|$)");
    private static final Pattern TAG_WITH_SELECTOR = Pattern.compile("(?i)^[a-z]+[.#\\[].*");

    private Locators() {
        // Utility class
    }

    /**
     * @param root expression the locator hangs off: {@code page}, {@code this.page} or a frame locator
     * @param selector selector to translate
     * @return locator expression, narrowed by the selector's position
     */
    static String locator(String root, Selector selector) {
        String value = TypeScript.quote(selector.value());
        String base = switch (selector.type()) {
            case AUTO -> looksLikeCssOrXPath(selector.value())
                ? root + ".locator(" + value + ")"
                : root + ".getByText(" + value + ")";
            case CSS -> root + ".locator(" + value + ")";
            case XPATH -> root + ".locator(" + TypeScript.quote(xpath(selector.value())) + ")";
            case TEXT -> root + ".getByText(" + value + ")";
            case ROLE -> role(root, value, selector.roleName());
            case TESTID -> root + ".getByTestId(" + value + ")";
            case LABEL -> root + ".getByLabel(" + value + ")";
            case PLACEHOLDER -> root + ".getByPlaceholder(" + value + ")";
            case ALT -> root + ".getByAltText(" + value + ")";
            case TITLE -> root + ".getByTitle(" + value + ")";
            case BUTTON, TEXTBOX, LINK, CHECKBOX, HEADING ->
                role(root, TypeScript.quote(selector.type().ariaRole()), selector.value());
        };
        return switch (selector.position()) {
            case ALL -> base;
            case FIRST -> base + ".first()";
            case LAST -> base + ".last()";
            case NTH -> base + ".nth(" + selector.nth() + ")";
        };
    }

    /**
     * Whether an untyped selector reads as CSS or XPath rather than visible text.
     */
    static boolean looksLikeCssOrXPath(String value) {
        return value.startsWith("#")
            || value.startsWith(".")
            || (value.startsWith("[") && value.contains("]"))
            || value.startsWith("//")
            || value.startsWith("/html")
            || value.contains(">")
            || value.contains("~")
            || value.contains("+")
            || (value.contains(":") && PSEUDO_CLASS.matcher(value).find())
            || TAG_WITH_SELECTOR.matcher(value).matches();
    }

    private static String role(String root, String quotedRole, String name) {
        if (name == null || name.isEmpty()) {
            return root + ".getByRole(" + quotedRole + ")";
        }
        return root + ".getByRole(" + quotedRole + ", { name: " + TypeScript.quote(name) + " })";
    }

    private static String xpath(String value) {
        return value.startsWith("xpath=") ? value : "xpath=" + value;
    }
}

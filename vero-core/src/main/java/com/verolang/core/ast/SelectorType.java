package com.verolang.core.ast;

/**
 * Selector kinds. Semantic kinds map to role-based locators.
 */
public enum SelectorType {
    AUTO(null),
    CSS(null),
    XPATH(null),
    TEXT(null),
    ROLE(null),
    TESTID(null),
    LABEL(null),
    PLACEHOLDER(null),
    ALT(null),
    TITLE(null),
    BUTTON("button"),
    TEXTBOX("textbox"),
    LINK("link"),
    CHECKBOX("checkbox"),
    HEADING("heading");

    private final String ariaRole;

    SelectorType(String ariaRole) {
        this.ariaRole = ariaRole;
    }

    /**
     * ARIA role implied by this kind, or null when the kind is not role-based.
     */
    public String ariaRole() {
        return ariaRole;
    }
}

package com.verolang.core.ast;

import java.util.Objects;

/**
 * {@code name} or {@code page.name}.
 *
 * <p>{@code page} holds whatever precedes the dot: a page name ({@code LoginPage.greeting}) or a
 * scope variable such as a data row ({@code user.email}).
 */
public record VariableReference(String page, String name) implements Expression {

    public VariableReference {
        Objects.requireNonNull(name, "name must not be null");
    }

    public String describe() {
        return page == null ? name : page + "." + name;
    }
}

package com.verolang.core.ast;

import java.util.Objects;

/**
 * {@code FIELD name = selector}.
 */
public record Field(String name, Selector selector, int line) {

    public Field {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(selector, "selector must not be null");
    }
}

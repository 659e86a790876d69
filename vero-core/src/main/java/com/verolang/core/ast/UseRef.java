package com.verolang.core.ast;

import java.util.Objects;

/**
 * {@code USE Name}.
 */
public record UseRef(String name, int line) {

    public UseRef {
        Objects.requireNonNull(name, "name must not be null");
    }
}

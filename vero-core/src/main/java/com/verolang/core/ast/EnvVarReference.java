package com.verolang.core.ast;

import java.util.Objects;

/**
 * {@code {{NAME}}}, resolved from the environment when the generated script runs.
 */
public record EnvVarReference(String name) implements Expression {

    public EnvVarReference {
        Objects.requireNonNull(name, "name must not be null");
    }
}

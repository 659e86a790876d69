package com.verolang.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code Page.action WITH arg1, arg2}. {@code page} is null for an unqualified call.
 */
public record ActionCall(String page, String action, List<Expression> arguments) {

    public ActionCall {
        Objects.requireNonNull(action, "action must not be null");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    public String describe() {
        return page == null ? action : page + "." + action;
    }
}

package com.verolang.core.ast;

/**
 * States an element can be verified or tested for.
 */
public enum ElementState {
    VISIBLE,
    HIDDEN,
    ENABLED,
    DISABLED,
    CHECKED,
    FOCUSED,
    EMPTY
}

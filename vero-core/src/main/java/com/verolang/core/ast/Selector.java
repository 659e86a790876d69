package com.verolang.core.ast;

import java.util.Objects;

/**
 * A way to locate elements.
 *
 * @param type selector kind; {@link SelectorType#AUTO} lets the transpiler infer CSS, XPath or text
 * @param value selector text, role, test id, label, ...
 * @param roleName accessible name for {@link SelectorType#ROLE}, or null
 * @param position narrowing applied when several elements match
 * @param nth zero-based index for {@link Position#NTH}, otherwise 0
 */
public record Selector(
    SelectorType type,
    String value,
    String roleName,
    Position position,
    int nth
) {
    public Selector {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(value, "value must not be null");
        if (position == null) {
            position = Position.ALL;
        }
    }

    public static Selector auto(String value) {
        return new Selector(SelectorType.AUTO, value, null, Position.ALL, 0);
    }

    public static Selector of(SelectorType type, String value) {
        return new Selector(type, value, null, Position.ALL, 0);
    }

    public Selector withPosition(Position newPosition, int index) {
        return new Selector(type, value, roleName, newPosition, index);
    }

    public enum Position {
        ALL,
        FIRST,
        LAST,
        NTH
    }
}

package com.verolang.core.selection;

/**
 * Thrown when a selection cannot be applied because a name pattern or tag expression is
 * malformed. Selecting zero scenarios is not an error.
 */
public class ScenarioSelectionException extends IllegalArgumentException {

    public ScenarioSelectionException(String message) {
        super(message);
    }

    public ScenarioSelectionException(String message, Throwable cause) {
        super(message, cause);
    }
}

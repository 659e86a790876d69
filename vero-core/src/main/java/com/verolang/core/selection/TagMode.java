package com.verolang.core.selection;

import java.util.Locale;

/**
 * How {@link ScenarioSelection#includeTags()} is applied.
 */
public enum TagMode {
    /** At least one of the tags must be present. */
    ANY,
    /** Every tag must be present. */
    ALL;

    /**
     * Parses {@code any} or {@code all}, ignoring case.
     *
     * @throws ScenarioSelectionException for any other value
     */
    public static TagMode fromId(String id) {
        if (id == null) {
            return ANY;
        }
        return switch (id.trim().toLowerCase(Locale.ROOT)) {
            case "any" -> ANY;
            case "all" -> ALL;
            default -> throw new ScenarioSelectionException("Unknown tag mode '" + id + "', expected 'any' or 'all'");
        };
    }
}

package com.verolang.core.error;

/**
 * Factories for failures to find or interact with an element.
 */
public final class LocatorErrors {

    private LocatorErrors() {
        // Utility class
    }

    public static VeroError notFound(String selector, String statement, ErrorLocation location) {
        return VeroError.builder(ErrorCode.ELEMENT_NOT_FOUND)
            .location(location)
            .whatWentWrong("Could not find the element '" + selector + "' on the page")
            .howToFix("Check that the page has loaded and the selector is correct.")
            .selector(selector)
            .veroStatement(statement)
            .suggestion(ErrorSuggestion.retry("Wait for the page to finish loading"))
            .suggestion(ErrorSuggestion.fix("Update the FIELD selector"))
            .build();
    }

    public static VeroError ambiguous(String selector, int count, String statement, ErrorLocation location) {
        return VeroError.builder(ErrorCode.MULTIPLE_ELEMENTS)
            .location(location)
            .whatWentWrong("'" + selector + "' matches " + count + " elements, expected exactly one")
            .howToFix("Make the selector more specific, or add FIRST, LAST or NTH.")
            .selector(selector)
            .veroStatement(statement)
            .actualValue(String.valueOf(count))
            .build();
    }

    public static VeroError notVisible(String selector, String statement, ErrorLocation location) {
        return VeroError.builder(ErrorCode.ELEMENT_NOT_VISIBLE)
            .location(location)
            .whatWentWrong("The element '" + selector + "' exists but is not visible")
            .howToFix("Scroll to it or wait until it appears.")
            .selector(selector)
            .veroStatement(statement)
            .build();
    }

    public static VeroError disabled(String selector, String statement, ErrorLocation location) {
        return VeroError.builder(ErrorCode.ELEMENT_DISABLED)
            .location(location)
            .whatWentWrong("The element '" + selector + "' is disabled")
            .howToFix("Complete the steps that enable it first.")
            .selector(selector)
            .veroStatement(statement)
            .build();
    }

    public static VeroError detached(String selector, String statement, ErrorLocation location) {
        return VeroError.builder(ErrorCode.ELEMENT_DETACHED)
            .location(location)
            .whatWentWrong("The element '" + selector + "' was removed from the page")
            .howToFix("Wait for the page to settle before interacting.")
            .selector(selector)
            .veroStatement(statement)
            .build();
    }

    public static VeroError covered(String selector, String statement, ErrorLocation location) {
        return VeroError.builder(ErrorCode.ELEMENT_COVERED)
            .location(location)
            .whatWentWrong("Another element is covering '" + selector + "'")
            .howToFix("Close overlays or popups first.")
            .selector(selector)
            .veroStatement(statement)
            .build();
    }

    public static VeroError outsideViewport(String selector, String statement, ErrorLocation location) {
        return VeroError.builder(ErrorCode.ELEMENT_OUTSIDE_VIEWPORT)
            .location(location)
            .whatWentWrong("The element '" + selector + "' is outside of the visible area")
            .howToFix("Add SCROLL TO before the interaction.")
            .selector(selector)
            .veroStatement(statement)
            .build();
    }
}

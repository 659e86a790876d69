package com.verolang.core.error;

/**
 * Factories for failed VERIFY statements.
 */
public final class AssertionErrors {

    private AssertionErrors() {
        // Utility class
    }

    public static VeroError visibilityFailed(String selector, boolean expectedVisible, String statement,
                                             ErrorLocation location) {
        return assertion(ErrorCode.VISIBILITY_FAILED,
            "'" + selector + "' should be " + (expectedVisible ? "visible" : "hidden") + " but is not",
            statement, location)
            .selector(selector)
            .expectedValue(expectedVisible ? "visible" : "hidden")
            .actualValue(expectedVisible ? "hidden" : "visible")
            .build();
    }

    public static VeroError textMismatch(String selector, String expected, String actual, String statement,
                                         ErrorLocation location) {
        return assertion(ErrorCode.TEXT_MISMATCH, "The text of '" + selector + "' did not match",
            statement, location)
            .selector(selector)
            .expectedValue(expected)
            .actualValue(actual)
            .build();
    }

    public static VeroError valueMismatch(String selector, String expected, String actual, String statement,
                                          ErrorLocation location) {
        return assertion(ErrorCode.VALUE_MISMATCH, "The value of '" + selector + "' did not match",
            statement, location)
            .selector(selector)
            .expectedValue(expected)
            .actualValue(actual)
            .build();
    }

    public static VeroError countMismatch(String selector, int expected, int actual, String statement,
                                          ErrorLocation location) {
        return assertion(ErrorCode.COUNT_MISMATCH, "Expected " + expected + " elements matching '" + selector
            + "' but found " + actual, statement, location)
            .selector(selector)
            .expectedValue(String.valueOf(expected))
            .actualValue(String.valueOf(actual))
            .build();
    }

    public static VeroError urlMismatch(String expected, String actual, String statement, ErrorLocation location) {
        return assertion(ErrorCode.URL_MISMATCH, "The page address did not match", statement, location)
            .expectedValue(expected)
            .actualValue(actual)
            .build();
    }

    public static VeroError titleMismatch(String expected, String actual, String statement, ErrorLocation location) {
        return assertion(ErrorCode.TITLE_MISMATCH, "The page title did not match", statement, location)
            .expectedValue(expected)
            .actualValue(actual)
            .build();
    }

    public static VeroError attributeMismatch(String selector, String attribute, String expected, String actual,
                                              String statement, ErrorLocation location) {
        return assertion(ErrorCode.ATTRIBUTE_MISMATCH, "Attribute '" + attribute + "' of '" + selector
            + "' did not match", statement, location)
            .selector(selector)
            .expectedValue(expected)
            .actualValue(actual)
            .build();
    }

    public static VeroError stateMismatch(String selector, String expectedState, String statement,
                                          ErrorLocation location) {
        return assertion(ErrorCode.STATE_MISMATCH, "'" + selector + "' is not " + expectedState,
            statement, location)
            .selector(selector)
            .expectedValue(expectedState)
            .build();
    }

    private static VeroError.Builder assertion(ErrorCode code, String what, String statement, ErrorLocation location) {
        return VeroError.builder(code)
            .location(location)
            .whatWentWrong(what)
            .veroStatement(statement)
            .howToFix("Check that the application behaves as the scenario expects, or update the expectation.")
            .suggestion(ErrorSuggestion.investigate("Compare the screenshot with the expected state"));
    }
}

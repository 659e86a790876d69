package com.verolang.core.error;

/**
 * Factories for timeouts during execution.
 */
public final class TimeoutErrors {

    private TimeoutErrors() {
        // Utility class
    }

    public static VeroError pageLoad(String url, long timeoutMs, String statement, ErrorLocation location) {
        return timeout(ErrorCode.PAGE_LOAD_TIMEOUT, "The page " + describe(url) + "did not load within "
            + timeoutMs + "ms", statement, location)
            .howToFix("Check that the site is up, or increase the timeout.")
            .build();
    }

    public static VeroError elementWait(String selector, long timeoutMs, String statement, ErrorLocation location) {
        return timeout(ErrorCode.ELEMENT_WAIT_TIMEOUT, "Waited " + timeoutMs + "ms for '" + selector
            + "' without success", statement, location)
            .selector(selector)
            .howToFix("Check the selector, or wait for the step that makes the element appear.")
            .build();
    }

    public static VeroError navigation(long timeoutMs, String statement, ErrorLocation location) {
        return timeout(ErrorCode.NAVIGATION_TIMEOUT, "Navigation did not finish within " + timeoutMs + "ms",
            statement, location)
            .howToFix("Check that the link or button actually navigates.")
            .build();
    }

    public static VeroError networkIdle(long timeoutMs, String statement, ErrorLocation location) {
        return timeout(ErrorCode.NETWORK_IDLE_TIMEOUT, "The network stayed busy for more than " + timeoutMs + "ms",
            statement, location)
            .howToFix("Wait for a specific element instead of network idle.")
            .build();
    }

    public static VeroError action(String action, long timeoutMs, String statement, ErrorLocation location) {
        return timeout(ErrorCode.ACTION_TIMEOUT, "'" + action + "' did not complete within " + timeoutMs + "ms",
            statement, location)
            .howToFix("Make sure the element is visible and enabled.")
            .build();
    }

    public static VeroError test(long timeoutMs, String statement, ErrorLocation location) {
        return timeout(ErrorCode.TEST_TIMEOUT, "The scenario took longer than " + timeoutMs + "ms",
            statement, location)
            .howToFix("Split the scenario or raise the test timeout.")
            .build();
    }

    private static VeroError.Builder timeout(ErrorCode code, String what, String statement, ErrorLocation location) {
        return VeroError.builder(code)
            .location(location)
            .whatWentWrong(what)
            .veroStatement(statement)
            .suggestion(ErrorSuggestion.retry("Run the scenario again"));
    }

    private static String describe(String url) {
        return url == null || url.isBlank() ? "" : "'" + url + "' ";
    }
}

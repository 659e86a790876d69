package com.verolang.core.error;

/**
 * Factories for browser and network failures that are not tied to a single element.
 */
public final class EnvironmentErrors {

    private EnvironmentErrors() {
        // Utility class
    }

    public static VeroError browser(ErrorCode code, String technicalMessage, String statement, ErrorLocation location) {
        requireCategory(code, ErrorCategory.BROWSER);
        return VeroError.builder(code)
            .location(location)
            .whatWentWrong(code.description())
            .howToFix(code == ErrorCode.BROWSER_NOT_INSTALLED
                ? "Install the browsers with 'npx playwright install'."
                : "Run the scenario again. If it keeps failing, check the browser logs.")
            .technicalMessage(technicalMessage)
            .veroStatement(statement)
            .build();
    }

    public static VeroError network(ErrorCode code, String technicalMessage, String statement, ErrorLocation location) {
        requireCategory(code, ErrorCategory.NETWORK);
        return VeroError.builder(code)
            .location(location)
            .whatWentWrong(code.description())
            .howToFix(code == ErrorCode.CORS_ERROR
                ? "Allow the origin on the server or test against the same origin."
                : "Check the network and the backend services.")
            .technicalMessage(technicalMessage)
            .veroStatement(statement)
            .build();
    }

    private static void requireCategory(ErrorCode code, ErrorCategory category) {
        if (code.category() != category) {
            throw new IllegalArgumentException(code.code() + " is not a " + category.id() + " error");
        }
    }
}

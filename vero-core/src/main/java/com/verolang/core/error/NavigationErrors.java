package com.verolang.core.error;

/**
 * Factories for navigation failures.
 */
public final class NavigationErrors {

    private NavigationErrors() {
        // Utility class
    }

    public static VeroError invalidUrl(String url, String statement, ErrorLocation location) {
        return navigation(ErrorCode.INVALID_URL, "'" + url + "' is not a valid address", statement, location)
            .howToFix("Use a full address such as https://example.com/login.")
            .build();
    }

    public static VeroError dnsNotResolved(String url, String statement, ErrorLocation location) {
        return navigation(ErrorCode.DNS_FAILED, "The site " + describe(url) + "could not be found",
            statement, location)
            .howToFix("Check the spelling of the address and your network.")
            .build();
    }

    public static VeroError connectionRefused(String url, String statement, ErrorLocation location) {
        return navigation(ErrorCode.CONNECTION_REFUSED, "The server " + describe(url) + "refused the connection",
            statement, location)
            .howToFix("Make sure the application is running.")
            .build();
    }

    public static VeroError sslError(String url, String statement, ErrorLocation location) {
        return navigation(ErrorCode.SSL_ERROR, "The security certificate of " + describe(url) + "is not trusted",
            statement, location)
            .howToFix("Fix the certificate or allow insecure certificates in the test environment.")
            .build();
    }

    public static VeroError httpError(String url, int status, String statement, ErrorLocation location) {
        ErrorCode code = status == 404 ? ErrorCode.PAGE_NOT_FOUND
            : status >= 500 ? ErrorCode.SERVER_ERROR
            : ErrorCode.HTTP_ERROR;
        return navigation(code, "The server answered with status " + status, statement, location)
            .actualValue(String.valueOf(status))
            .technicalMessage("HTTP " + status + (url == null ? "" : " for " + url))
            .howToFix(status == 404 ? "Check the address." : "Check the server logs.")
            .build();
    }

    public static VeroError offline(String statement, ErrorLocation location) {
        return navigation(ErrorCode.NAVIGATION_OFFLINE, "The browser is offline", statement, location)
            .howToFix("Check the network connection of the machine running the tests.")
            .build();
    }

    private static VeroError.Builder navigation(ErrorCode code, String what, String statement, ErrorLocation location) {
        return VeroError.builder(code)
            .location(location)
            .whatWentWrong(what)
            .veroStatement(statement);
    }

    private static String describe(String url) {
        return url == null || url.isBlank() ? "" : "'" + url + "' ";
    }
}

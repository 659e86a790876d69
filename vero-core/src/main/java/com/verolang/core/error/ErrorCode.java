package com.verolang.core.error;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Registry of every error code Vero reports.
 *
 * <p>Each constant carries the defaults a {@link VeroError} built from it starts with:
 * category, title, severity, flakiness and retry hints.
 *
 * <p>Code ranges:
 * <ul>
 *   <li>{@code VERO-101..105} lexical errors</li>
 *   <li>{@code VERO-100, VERO-200..210} semantic validation</li>
 *   <li>{@code VERO-301..307} syntax errors</li>
 *   <li>{@code VERO-4xx..9xx} execution-time failures (locator, timeout, navigation,
 *       assertion, browser, network)</li>
 * </ul>
 */
public enum ErrorCode {

    // Lexer
    UNEXPECTED_CHARACTER("VERO-101", ErrorCategory.LEXER, "Unexpected Character",
        "The source contains a character Vero does not understand."),
    UNTERMINATED_STRING("VERO-102", ErrorCategory.LEXER, "Unterminated String",
        "A quoted string is missing its closing quote."),
    INVALID_NUMBER("VERO-103", ErrorCategory.LEXER, "Invalid Number",
        "A number is not written in a valid format."),
    UNKNOWN_TOKEN("VERO-104", ErrorCategory.LEXER, "Unknown Token",
        "A token could not be recognized."),
    UNTERMINATED_REFERENCE("VERO-105", ErrorCategory.LEXER, "Unterminated Reference",
        "An environment variable reference is missing its closing braces."),

    // Validation
    DUPLICATE_DEFINITION("VERO-100", ErrorCategory.VALIDATION, "Duplicate Definition",
        "The same name is defined more than once."),
    UNRESOLVED_USE("VERO-200", ErrorCategory.VALIDATION, "Undefined Page",
        "A USE statement names a page or page actions library that does not exist."),
    PAGE_NOT_IMPORTED("VERO-201", ErrorCategory.VALIDATION, "Page Not Imported",
        "A statement references a page the feature does not USE."),
    UNDEFINED_ACTION("VERO-202", ErrorCategory.VALIDATION, "Undefined Action",
        "PERFORM names an action that does not exist."),
    UNDEFINED_COLLECTION("VERO-203", ErrorCategory.VALIDATION, "Undefined Collection",
        "FOR EACH loops over a variable that has not been loaded."),
    UNDEFINED_VARIABLE("VERO-204", ErrorCategory.VALIDATION, ErrorSeverity.WARNING, "Undefined Variable",
        "A variable may not be defined at this point."),
    UNDEFINED_FIELD("VERO-205", ErrorCategory.VALIDATION, ErrorSeverity.WARNING, "Undefined Field",
        "A field may not be defined on the referenced page."),
    INVALID_PAGE_ACTIONS_TARGET("VERO-206", ErrorCategory.VALIDATION, "Invalid Page Actions Target",
        "PAGEACTIONS ... FOR names a page that does not exist."),
    TAB_OPERATION_NOT_ALLOWED("VERO-207", ErrorCategory.VALIDATION, "Tab Operation Not Allowed",
        "Tab control is used where no tab can be switched."),
    WRONG_ARGUMENT_COUNT("VERO-208", ErrorCategory.VALIDATION, "Wrong Number of Arguments",
        "An action is called with a different number of arguments than it declares."),
    NAMING_CONVENTION("VERO-210", ErrorCategory.VALIDATION, ErrorSeverity.WARNING, "Naming Convention",
        "A name does not follow Vero naming conventions."),

    // Parser
    MISSING_KEYWORD("VERO-301", ErrorCategory.PARSER, "Missing Keyword",
        "A required keyword is missing."),
    MISSING_BRACE("VERO-302", ErrorCategory.PARSER, "Missing Brace",
        "An opening or closing brace is missing."),
    INVALID_STATEMENT("VERO-303", ErrorCategory.PARSER, "Invalid Statement",
        "The line does not start with a known statement."),
    MISSING_STRING("VERO-304", ErrorCategory.PARSER, "Missing String",
        "A quoted string was expected."),
    MISSING_NAME("VERO-305", ErrorCategory.PARSER, "Missing Name",
        "A name was expected."),
    UNEXPECTED_TOKEN("VERO-306", ErrorCategory.PARSER, "Unexpected Token",
        "Something unexpected was found."),
    INCOMPLETE_STATEMENT("VERO-307", ErrorCategory.PARSER, "Incomplete Statement",
        "The file ended before the statement or block was complete."),

    // Locator
    ELEMENT_NOT_FOUND("VERO-401", ErrorCategory.LOCATOR, "Element Not Found",
        "No element matches the selector.", Flakiness.FLAKY, 3),
    MULTIPLE_ELEMENTS("VERO-402", ErrorCategory.LOCATOR, "Multiple Elements Found",
        "The selector matches more than one element."),
    ELEMENT_NOT_VISIBLE("VERO-403", ErrorCategory.LOCATOR, "Element Not Visible",
        "The element exists but is not visible.", Flakiness.FLAKY, 2),
    ELEMENT_DISABLED("VERO-404", ErrorCategory.LOCATOR, "Element Disabled",
        "The element is disabled."),
    ELEMENT_DETACHED("VERO-405", ErrorCategory.LOCATOR, "Element Detached",
        "The element was removed from the page.", Flakiness.FLAKY, 2),
    ELEMENT_COVERED("VERO-406", ErrorCategory.LOCATOR, "Element Covered",
        "Another element receives the interaction.", Flakiness.FLAKY, 2),
    ELEMENT_OUTSIDE_VIEWPORT("VERO-407", ErrorCategory.LOCATOR, "Element Outside Viewport",
        "The element is outside of the viewport.", Flakiness.FLAKY, 2),

    // Timeout
    PAGE_LOAD_TIMEOUT("VERO-501", ErrorCategory.TIMEOUT, "Page Load Timeout",
        "The page took too long to load.", Flakiness.FLAKY, 2),
    ELEMENT_WAIT_TIMEOUT("VERO-502", ErrorCategory.TIMEOUT, "Element Wait Timeout",
        "An element did not reach the expected state in time.", Flakiness.FLAKY, 2),
    NAVIGATION_TIMEOUT("VERO-503", ErrorCategory.TIMEOUT, "Navigation Timeout",
        "Navigation did not finish in time.", Flakiness.FLAKY, 2),
    NETWORK_IDLE_TIMEOUT("VERO-504", ErrorCategory.TIMEOUT, "Network Idle Timeout",
        "The network did not become idle in time.", Flakiness.FLAKY, 2),
    ACTION_TIMEOUT("VERO-505", ErrorCategory.TIMEOUT, "Action Timeout",
        "An interaction did not complete in time.", Flakiness.FLAKY, 2),
    TEST_TIMEOUT("VERO-506", ErrorCategory.TIMEOUT, "Test Timeout",
        "The scenario exceeded its time limit.", Flakiness.FLAKY, 1),

    // Navigation
    INVALID_URL("VERO-601", ErrorCategory.NAVIGATION, "Invalid URL",
        "The URL is not valid."),
    DNS_FAILED("VERO-602", ErrorCategory.NAVIGATION, "DNS Failed",
        "The host name could not be resolved.", Flakiness.FLAKY, 2),
    CONNECTION_REFUSED("VERO-603", ErrorCategory.NAVIGATION, "Connection Refused",
        "The server refused the connection.", Flakiness.FLAKY, 2),
    SSL_ERROR("VERO-604", ErrorCategory.NAVIGATION, "SSL Certificate Error",
        "The server certificate is not trusted."),
    HTTP_ERROR("VERO-605", ErrorCategory.NAVIGATION, "HTTP Error",
        "The server answered with an error status.", Flakiness.FLAKY, 2),
    PAGE_NOT_FOUND("VERO-606", ErrorCategory.NAVIGATION, "Page Not Found (404)",
        "The server answered 404 Not Found."),
    SERVER_ERROR("VERO-607", ErrorCategory.NAVIGATION, "Server Error (5xx)",
        "The server failed to handle the request.", Flakiness.FLAKY, 2),
    NAVIGATION_OFFLINE("VERO-608", ErrorCategory.NAVIGATION, "Network Offline",
        "The browser has no network connection.", Flakiness.FLAKY, 2),

    // Assertion
    VISIBILITY_FAILED("VERO-701", ErrorCategory.ASSERTION, "Visibility Check Failed",
        "The element visibility did not match the expectation.", Flakiness.FLAKY, 1),
    TEXT_MISMATCH("VERO-702", ErrorCategory.ASSERTION, "Text Mismatch",
        "The element text did not match.", Flakiness.FLAKY, 1),
    VALUE_MISMATCH("VERO-703", ErrorCategory.ASSERTION, "Value Mismatch",
        "The value did not match.", Flakiness.FLAKY, 1),
    COUNT_MISMATCH("VERO-704", ErrorCategory.ASSERTION, "Count Mismatch",
        "The number of elements did not match.", Flakiness.FLAKY, 1),
    URL_MISMATCH("VERO-705", ErrorCategory.ASSERTION, "URL Mismatch",
        "The page URL did not match.", Flakiness.FLAKY, 1),
    TITLE_MISMATCH("VERO-706", ErrorCategory.ASSERTION, "Title Mismatch",
        "The page title did not match.", Flakiness.FLAKY, 1),
    ATTRIBUTE_MISMATCH("VERO-707", ErrorCategory.ASSERTION, "Attribute Mismatch",
        "An element attribute did not match.", Flakiness.FLAKY, 1),
    STATE_MISMATCH("VERO-708", ErrorCategory.ASSERTION, "State Mismatch",
        "The element state did not match.", Flakiness.FLAKY, 1),

    // Browser
    BROWSER_CRASHED("VERO-801", ErrorCategory.BROWSER, "Browser Crashed",
        "The browser process terminated unexpectedly.", Flakiness.FLAKY, 2),
    BROWSER_NOT_INSTALLED("VERO-802", ErrorCategory.BROWSER, "Browser Not Installed",
        "The requested browser is not installed."),
    CONTEXT_CLOSED("VERO-803", ErrorCategory.BROWSER, "Context Closed",
        "The browser context was closed.", Flakiness.FLAKY, 2),
    PAGE_CLOSED("VERO-804", ErrorCategory.BROWSER, "Page Closed",
        "The page was closed.", Flakiness.FLAKY, 2),
    FRAME_DETACHED("VERO-805", ErrorCategory.BROWSER, "Frame Detached",
        "The frame was detached from the page.", Flakiness.FLAKY, 2),
    POPUP_NOT_FOUND("VERO-806", ErrorCategory.BROWSER, "Popup Not Found",
        "An expected popup or tab did not open.", Flakiness.FLAKY, 2),

    // Network
    OFFLINE("VERO-901", ErrorCategory.NETWORK, "Offline",
        "The network is unavailable.", Flakiness.FLAKY, 2),
    REQUEST_FAILED("VERO-902", ErrorCategory.NETWORK, "Request Failed",
        "A network request failed.", Flakiness.FLAKY, 2),
    CORS_ERROR("VERO-903", ErrorCategory.NETWORK, "CORS Error",
        "A cross-origin request was blocked."),
    REQUEST_TIMEOUT("VERO-904", ErrorCategory.NETWORK, "Request Timeout",
        "A network request timed out.", Flakiness.FLAKY, 2),
    WEBSOCKET_ERROR("VERO-905", ErrorCategory.NETWORK, "WebSocket Error",
        "A WebSocket connection failed.", Flakiness.FLAKY, 2);

    private final String code;
    private final ErrorCategory category;
    private final ErrorSeverity defaultSeverity;
    private final String title;
    private final String description;
    private final Flakiness flakiness;
    private final int suggestedRetries;

    ErrorCode(String code, ErrorCategory category, String title, String description) {
        this(code, category, ErrorSeverity.ERROR, title, description, Flakiness.PERMANENT, 0);
    }

    ErrorCode(String code, ErrorCategory category, ErrorSeverity severity, String title, String description) {
        this(code, category, severity, title, description, Flakiness.PERMANENT, 0);
    }

    ErrorCode(String code, ErrorCategory category, String title, String description,
              Flakiness flakiness, int suggestedRetries) {
        this(code, category, ErrorSeverity.ERROR, title, description, flakiness, suggestedRetries);
    }

    ErrorCode(String code, ErrorCategory category, ErrorSeverity defaultSeverity, String title,
              String description, Flakiness flakiness, int suggestedRetries) {
        this.code = code;
        this.category = category;
        this.defaultSeverity = defaultSeverity;
        this.title = title;
        this.description = description;
        this.flakiness = flakiness;
        this.suggestedRetries = suggestedRetries;
    }

    public String code() {
        return code;
    }

    public ErrorCategory category() {
        return category;
    }

    public ErrorSeverity defaultSeverity() {
        return defaultSeverity;
    }

    public String title() {
        return title;
    }

    public String description() {
        return description;
    }

    public Flakiness flakiness() {
        return flakiness;
    }

    public boolean retryable() {
        return flakiness == Flakiness.FLAKY;
    }

    public int suggestedRetries() {
        return suggestedRetries;
    }

    /**
     * Finds the registry entry for a code string such as {@code "VERO-201"}.
     *
     * @param code code string, case-insensitive
     * @return the entry, or empty when the code is unknown
     */
    public static Optional<ErrorCode> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(entry -> entry.code.equalsIgnoreCase(code.trim()))
            .findFirst();
    }

    /**
     * Returns the registry entries of one category in declaration order.
     *
     * @param category category to filter on
     * @return matching codes
     */
    public static List<ErrorCode> byCategory(ErrorCategory category) {
        return Arrays.stream(values())
            .filter(entry -> entry.category == category)
            .toList();
    }
}

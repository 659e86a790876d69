package com.verolang.core.error;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates raw Playwright failure messages into {@link VeroError}s.
 *
 * <p>Patterns are tried in descending priority; the first match wins. Messages that match no
 * pattern are left to the caller, which can still use {@link #guessCategory(String)}.
 */
public final class RuntimeErrorMapper {

    @FunctionalInterface
    private interface ErrorFactory {
        VeroError create(Matcher match, String statement, ErrorLocation location);
    }

    private record ErrorPattern(Pattern pattern, int priority, ErrorFactory factory) {}

    private static final Pattern LINE_REFERENCE = Pattern.compile(":(\\d+):\\d+");

    private static final List<ErrorPattern> PATTERNS = List.of(
        // Locator
        pattern("strict mode violation: .*? resolved to (\\d+) elements", 99,
            (m, s, l) -> LocatorErrors.ambiguous("element", Integer.parseInt(m.group(1)), s, l)),
        pattern("Locator resolves to (\\d+) elements?", 100,
            (m, s, l) -> "0".equals(m.group(1))
                ? LocatorErrors.notFound("element", s, l)
                : LocatorErrors.ambiguous("element", Integer.parseInt(m.group(1)), s, l)),
        pattern("element is not visible", 95, (m, s, l) -> LocatorErrors.notVisible("element", s, l)),
        pattern("element is not attached to the DOM", 95, (m, s, l) -> LocatorErrors.detached("element", s, l)),
        pattern("element is disabled", 95, (m, s, l) -> LocatorErrors.disabled("element", s, l)),
        pattern("element is outside of the viewport", 90, (m, s, l) -> LocatorErrors.outsideViewport("element", s, l)),
        pattern("element (?:is|was) (?:covered|intercepted)|intercepts pointer events", 90,
            (m, s, l) -> LocatorErrors.covered("element", s, l)),

        // Timeout
        pattern("Test timeout of (\\d+)ms exceeded", 70,
            (m, s, l) -> TimeoutErrors.test(Long.parseLong(m.group(1)), s, l)),
        pattern("page\\.goto.*?Timeout (\\d+)ms exceeded", 80,
            (m, s, l) -> TimeoutErrors.pageLoad(null, Long.parseLong(m.group(1)), s, l)),
        pattern("waitForLoadState.*?networkidle.*?Timeout (\\d+)ms", 77,
            (m, s, l) -> TimeoutErrors.networkIdle(Long.parseLong(m.group(1)), s, l)),
        pattern("(click|fill|check|hover|press|selectOption).*?Timeout (\\d+)ms exceeded", 76,
            (m, s, l) -> TimeoutErrors.action(m.group(1), Long.parseLong(m.group(2)), s, l)),
        pattern("Timeout (\\d+)ms exceeded", 75,
            (m, s, l) -> TimeoutErrors.elementWait("element", Long.parseLong(m.group(1)), s, l)),

        // Navigation
        pattern("net::ERR_INTERNET_DISCONNECTED", 90, (m, s, l) -> NavigationErrors.offline(s, l)),
        pattern("invalid url|Protocol \".+?\" is not supported", 85,
            (m, s, l) -> NavigationErrors.invalidUrl("", s, l)),
        pattern("net::ERR_NAME_NOT_RESOLVED|DNS_PROBE_FINISHED", 85,
            (m, s, l) -> NavigationErrors.dnsNotResolved(null, s, l)),
        pattern("net::ERR_CONNECTION_REFUSED", 85, (m, s, l) -> NavigationErrors.connectionRefused(null, s, l)),
        pattern("net::ERR_CERT_|SSL_PROTOCOL_ERROR", 85, (m, s, l) -> NavigationErrors.sslError(null, s, l)),
        pattern("status code (\\d{3})", 75,
            (m, s, l) -> NavigationErrors.httpError(null, Integer.parseInt(m.group(1)), s, l)),

        // Assertion
        pattern("expect\\(.*?\\)\\.(?:not\\.)?toBeVisible", 70,
            (m, s, l) -> AssertionErrors.visibilityFailed("element", true, s, l)),
        pattern("expect\\(.*?\\)\\.(?:not\\.)?toBeHidden", 70,
            (m, s, l) -> AssertionErrors.visibilityFailed("element", false, s, l)),
        pattern("expect\\(.*?\\)\\.toHaveText.*?Expected[^\"']*[\"'](.*?)[\"'].*?Received[^\"']*[\"'](.*?)[\"']", 70,
            (m, s, l) -> AssertionErrors.textMismatch("element", m.group(1), m.group(2), s, l)),
        pattern("expect\\(.*?\\)\\.toContainText.*?Expected[^\"']*[\"'](.*?)[\"']", 69,
            (m, s, l) -> AssertionErrors.textMismatch("element", m.group(1), "", s, l)),
        pattern("expect\\(.*?\\)\\.toHaveValue.*?Expected[^\"']*[\"'](.*?)[\"'].*?Received[^\"']*[\"'](.*?)[\"']", 70,
            (m, s, l) -> AssertionErrors.valueMismatch("element", m.group(1), m.group(2), s, l)),
        pattern("expect\\(.*?\\)\\.toHaveCount.*?Expected: (\\d+).*?Received: (\\d+)", 70,
            (m, s, l) -> AssertionErrors.countMismatch("element",
                Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), s, l)),
        pattern("expect\\(.*?\\)\\.toHaveURL.*?Expected[^\"']*[\"'](.*?)[\"'].*?Received[^\"']*[\"'](.*?)[\"']", 70,
            (m, s, l) -> AssertionErrors.urlMismatch(m.group(1), m.group(2), s, l)),
        pattern("expect\\(.*?\\)\\.toHaveTitle.*?Expected[^\"']*[\"'](.*?)[\"'].*?Received[^\"']*[\"'](.*?)[\"']", 70,
            (m, s, l) -> AssertionErrors.titleMismatch(m.group(1), m.group(2), s, l)),

        // Browser
        pattern("Executable doesn't exist|browserType\\.launch.*?not found", 85,
            (m, s, l) -> EnvironmentErrors.browser(ErrorCode.BROWSER_NOT_INSTALLED, m.group(), s, l)),
        pattern("Browser closed|browser has been closed|Target crashed", 80,
            (m, s, l) -> EnvironmentErrors.browser(ErrorCode.BROWSER_CRASHED, m.group(), s, l)),
        pattern("Target page, context or browser has been closed", 81,
            (m, s, l) -> EnvironmentErrors.browser(ErrorCode.PAGE_CLOSED, m.group(), s, l)),
        pattern("frame was detached", 80,
            (m, s, l) -> EnvironmentErrors.browser(ErrorCode.FRAME_DETACHED, m.group(), s, l)),

        // Network
        pattern("CORS policy", 85, (m, s, l) -> EnvironmentErrors.network(ErrorCode.CORS_ERROR, m.group(), s, l)),
        pattern("WebSocket", 60, (m, s, l) -> EnvironmentErrors.network(ErrorCode.WEBSOCKET_ERROR, m.group(), s, l)),
        pattern("net::ERR_FAILED|request failed", 60,
            (m, s, l) -> EnvironmentErrors.network(ErrorCode.REQUEST_FAILED, m.group(), s, l))
    ).stream()
        .sorted(Comparator.comparingInt(ErrorPattern::priority).reversed())
        .toList();

    private RuntimeErrorMapper() {
        // Utility class
    }

    /**
     * Maps a raw failure message.
     *
     * @param message raw message from the automation runner
     * @param statement source statement being executed, or null
     * @param location source position of that statement, or null
     * @return the mapped error with the raw message as its technical message, or empty when no
     *     pattern matches
     */
    public static Optional<VeroError> map(String message, String statement, ErrorLocation location) {
        if (message == null || message.isBlank()) {
            return Optional.empty();
        }
        for (ErrorPattern candidate : PATTERNS) {
            Matcher matcher = candidate.pattern().matcher(message);
            if (matcher.find()) {
                VeroError mapped = candidate.factory().create(matcher, statement, location);
                return Optional.of(withTechnicalMessage(mapped, message));
            }
        }
        return Optional.empty();
    }

    public static boolean isKnownError(String message) {
        return message != null && PATTERNS.stream().anyMatch(p -> p.pattern().matcher(message).find());
    }

    /**
     * Keyword-based fallback classification for messages no pattern recognizes.
     */
    public static Optional<ErrorCategory> guessCategory(String message) {
        if (message == null) {
            return Optional.empty();
        }
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("locator") || lower.contains("element")) {
            return Optional.of(ErrorCategory.LOCATOR);
        }
        if (lower.contains("timeout")) {
            return Optional.of(ErrorCategory.TIMEOUT);
        }
        if (lower.contains("navigation") || lower.contains("net::")) {
            return Optional.of(ErrorCategory.NAVIGATION);
        }
        if (lower.contains("expect") || lower.contains("assertion")) {
            return Optional.of(ErrorCategory.ASSERTION);
        }
        if (lower.contains("browser") || lower.contains("context")) {
            return Optional.of(ErrorCategory.BROWSER);
        }
        if (lower.contains("network") || lower.contains("cors")) {
            return Optional.of(ErrorCategory.NETWORK);
        }
        return Optional.empty();
    }

    /**
     * Extracts the first {@code :line:column} reference from a stack trace, or 0 when absent.
     */
    public static int extractLine(String stackTrace) {
        if (stackTrace == null) {
            return 0;
        }
        Matcher matcher = LINE_REFERENCE.matcher(stackTrace);
        return matcher.find() ? Integer.parseInt(matcher.group(1)) : 0;
    }

    private static ErrorPattern pattern(String regex, int priority, ErrorFactory factory) {
        return new ErrorPattern(Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.DOTALL), priority, factory);
    }

    private static VeroError withTechnicalMessage(VeroError error, String message) {
        return new VeroError(error.code(), error.category(), error.severity(), error.location(), error.title(),
            error.whatWentWrong(), error.howToFix(), message, error.flakiness(), error.retryable(),
            error.suggestedRetries(), error.suggestions(), error.veroStatement(), error.selector(),
            error.expectedValue(), error.actualValue());
    }
}

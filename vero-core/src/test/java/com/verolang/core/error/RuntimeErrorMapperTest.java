package com.verolang.core.error;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RuntimeErrorMapper}.
 */
class RuntimeErrorMapperTest {

    private static final ErrorLocation LOCATION = ErrorLocation.at(12, 5);

    @Test
    void map_zeroElements_returnsElementNotFoundWithRawMessage() {
        String raw = "Error: Locator resolves to 0 elements";

        Optional<VeroError> result = RuntimeErrorMapper.map(raw, "CLICK LoginPage.submit", LOCATION);

        assertThat(result).isPresent();
        VeroError error = result.get();
        assertThat(error.code()).isEqualTo("VERO-401");
        assertThat(error.category()).isEqualTo(ErrorCategory.LOCATOR);
        assertThat(error.technicalMessage()).isEqualTo(raw);
        assertThat(error.veroStatement()).isEqualTo("CLICK LoginPage.submit");
        assertThat(error.line()).isEqualTo(12);
        assertThat(error.retryable()).isTrue();
        assertThat(error.suggestedRetries()).isEqualTo(3);
    }

    @Test
    void map_strictModeViolation_returnsMultipleElementsWithCount() {
        String raw = "strict mode violation: getByRole('button', { name: 'Save' }) resolved to 3 elements";

        VeroError error = RuntimeErrorMapper.map(raw, null, null).orElseThrow();

        assertThat(error.code()).isEqualTo("VERO-402");
        assertThat(error.actualValue()).isEqualTo("3");
        assertThat(error.location()).isNull();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "Test timeout of 30000ms exceeded.|VERO-506",
        "page.goto: Timeout 15000ms exceeded.|VERO-501",
        "locator.click: Timeout 5000ms exceeded.|VERO-505",
        "Timeout 30000ms exceeded.|VERO-502",
        "page.goto: net::ERR_CONNECTION_REFUSED at http://localhost:3000/|VERO-603",
        "page.goto: net::ERR_NAME_NOT_RESOLVED at https://nowhere.invalid/|VERO-602",
        "element is not visible|VERO-403",
        "Target page, context or browser has been closed|VERO-804",
        "has been blocked by CORS policy|VERO-903"
    })
    void map_knownMessages_returnsExpectedCode(String message, String expectedCode) {
        assertThat(RuntimeErrorMapper.map(message, null, LOCATION))
            .get()
            .extracting(VeroError::code)
            .isEqualTo(expectedCode);
    }

    @Test
    void map_countAssertion_carriesExpectedAndActual() {
        String raw = """
            expect(locator).toHaveCount(expected)
            Expected: 2
            Received: 5
            """;

        VeroError error = RuntimeErrorMapper.map(raw, null, LOCATION).orElseThrow();

        assertThat(error.code()).isEqualTo("VERO-704");
        assertThat(error.expectedValue()).isEqualTo("2");
        assertThat(error.actualValue()).isEqualTo("5");
    }

    @Test
    void map_unknownMessage_returnsEmpty() {
        assertThat(RuntimeErrorMapper.map("Something odd happened", null, LOCATION)).isEmpty();
        assertThat(RuntimeErrorMapper.map("  ", null, LOCATION)).isEmpty();
        assertThat(RuntimeErrorMapper.map(null, null, LOCATION)).isEmpty();
    }

    @Test
    void isKnownError_distinguishesRecognizedMessages() {
        assertThat(RuntimeErrorMapper.isKnownError("net::ERR_INTERNET_DISCONNECTED")).isTrue();
        assertThat(RuntimeErrorMapper.isKnownError("Something odd happened")).isFalse();
        assertThat(RuntimeErrorMapper.isKnownError(null)).isFalse();
    }

    @Test
    void guessCategory_usesKeywordFallback() {
        assertThat(RuntimeErrorMapper.guessCategory("Element handle is stale")).contains(ErrorCategory.LOCATOR);
        assertThat(RuntimeErrorMapper.guessCategory("waiting hit a timeout")).contains(ErrorCategory.TIMEOUT);
        assertThat(RuntimeErrorMapper.guessCategory("net::ERR_ABORTED")).contains(ErrorCategory.NAVIGATION);
        assertThat(RuntimeErrorMapper.guessCategory("Assertion failed")).contains(ErrorCategory.ASSERTION);
        assertThat(RuntimeErrorMapper.guessCategory("Browser went away")).contains(ErrorCategory.BROWSER);
        assertThat(RuntimeErrorMapper.guessCategory("CORS preflight")).contains(ErrorCategory.NETWORK);
        assertThat(RuntimeErrorMapper.guessCategory("Disk full")).isEmpty();
    }

    @Test
    void extractLine_findsFirstLineReference() {
        String stack = """
            Error: boom
                at /work/tests/Login.spec.ts:42:7
                at /work/node_modules/runner.js:10:3
            """;

        assertThat(RuntimeErrorMapper.extractLine(stack)).isEqualTo(42);
        assertThat(RuntimeErrorMapper.extractLine("no references here")).isZero();
        assertThat(RuntimeErrorMapper.extractLine(null)).isZero();
    }
}

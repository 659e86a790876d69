package com.verolang.core.error;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link VeroError} and the {@link ErrorCode} registry.
 */
class VeroErrorTest {

    @Test
    void builder_startsFromRegistryDefaults() {
        VeroError error = VeroError.builder(ErrorCode.ELEMENT_NOT_VISIBLE).build();

        assertThat(error.code()).isEqualTo("VERO-403");
        assertThat(error.category()).isEqualTo(ErrorCategory.LOCATOR);
        assertThat(error.severity()).isEqualTo(ErrorSeverity.ERROR);
        assertThat(error.title()).isEqualTo("Element Not Visible");
        assertThat(error.whatWentWrong()).isEqualTo("The element exists but is not visible.");
        assertThat(error.howToFix()).isEmpty();
        assertThat(error.flakiness()).isEqualTo(Flakiness.FLAKY);
        assertThat(error.retryable()).isTrue();
        assertThat(error.suggestedRetries()).isEqualTo(2);
        assertThat(error.suggestions()).isEmpty();
        assertThat(error.line()).isZero();
    }

    @Test
    void constructor_compileTimeCategory_forcesPermanentAndNotRetryable() {
        VeroError error = VeroError.builder(ErrorCode.INVALID_STATEMENT)
            .flakiness(Flakiness.FLAKY)
            .retryable(true)
            .suggestedRetries(5)
            .build();

        assertThat(error.isCompileTime()).isTrue();
        assertThat(error.flakiness()).isEqualTo(Flakiness.PERMANENT);
        assertThat(error.retryable()).isFalse();
        assertThat(error.suggestedRetries()).isZero();
        assertThat(error.shouldRetry(1)).isFalse();
    }

    @Test
    void shouldRetry_stopsWhenBudgetIsExhausted() {
        VeroError error = VeroError.builder(ErrorCode.ELEMENT_NOT_FOUND).build();

        assertThat(error.shouldRetry(1)).isTrue();
        assertThat(error.shouldRetry(3)).isTrue();
        assertThat(error.shouldRetry(4)).isFalse();
    }

    @Test
    void toShortMessage_includesCodeTitleAndLine() {
        VeroError error = VeroError.builder(ErrorCode.PAGE_NOT_IMPORTED)
            .whatWentWrong("'CartPage' is referenced but not used")
            .location(ErrorLocation.at(3, 9))
            .build();

        assertThat(error.toShortMessage())
            .isEqualTo("[VERO-201] Page Not Imported: 'CartPage' is referenced but not used (line 3)");
    }

    @Test
    void toDisplayMessage_listsStatementValuesAndSuggestions() {
        VeroError error = VeroError.builder(ErrorCode.TEXT_MISMATCH)
            .location(ErrorLocation.at(7, 3))
            .veroStatement("VERIFY HomePage.title HAS TEXT \"Welcome\"")
            .whatWentWrong("Text differs")
            .expectedValue("Welcome")
            .actualValue("Hello")
            .howToFix("Update the expected text.")
            .suggestion(ErrorSuggestion.investigate("Check the page language"))
            .build();

        String display = error.toDisplayMessage();

        assertThat(display).startsWith("ERROR VERO-702: Text Mismatch (line 7, column 3)");
        assertThat(display)
            .contains("Statement: VERIFY HomePage.title HAS TEXT \"Welcome\"")
            .contains("What went wrong: Text differs")
            .contains("Expected: Welcome, actual: Hello")
            .contains("How to fix: Update the expected text.")
            .contains("- Check the page language");
    }

    @Test
    void warningCodes_defaultToWarningSeverity() {
        VeroError error = VeroError.builder(ErrorCode.UNDEFINED_FIELD).build();

        assertThat(error.isError()).isFalse();
        assertThat(error.severity().id()).isEqualTo("warning");
    }

    @Test
    void constructor_copiesSuggestions() {
        List<ErrorSuggestion> suggestions = new ArrayList<>(List.of(ErrorSuggestion.fix("a")));
        VeroError error = VeroError.builder(ErrorCode.OFFLINE).suggestions(suggestions).build();

        suggestions.add(ErrorSuggestion.fix("b"));

        assertThat(error.suggestions()).extracting(ErrorSuggestion::text).containsExactly("a");
    }

    @Test
    void fromCode_isCaseInsensitive() {
        assertThat(ErrorCode.fromCode("vero-603")).contains(ErrorCode.CONNECTION_REFUSED);
        assertThat(ErrorCode.fromCode(" VERO-100 ")).contains(ErrorCode.DUPLICATE_DEFINITION);
        assertThat(ErrorCode.fromCode("VERO-999")).isEmpty();
        assertThat(ErrorCode.fromCode(null)).isEmpty();
    }

    @Test
    void byCategory_returnsCodesInDeclarationOrder() {
        assertThat(ErrorCode.byCategory(ErrorCategory.LEXER))
            .extracting(ErrorCode::code)
            .containsExactly("VERO-101", "VERO-102", "VERO-103", "VERO-104", "VERO-105");
    }

    @Test
    void registry_codesAreUnique() {
        assertThat(ErrorCode.values())
            .extracting(ErrorCode::code)
            .doesNotHaveDuplicates();
    }

    @Test
    void fromId_unknownCategory_throws() {
        assertThat(ErrorCategory.fromId("Network")).isEqualTo(ErrorCategory.NETWORK);
        assertThatThrownBy(() -> ErrorCategory.fromId("disk"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unknown error category: disk");
    }

    @Test
    void location_rejectsNonPositiveLine() {
        assertThat(ErrorLocation.atLine(0).line()).isEqualTo(1);
        assertThatThrownBy(() -> ErrorLocation.at(0, 1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("line must be >= 1");
    }
}

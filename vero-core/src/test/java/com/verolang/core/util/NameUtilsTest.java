package com.verolang.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link NameUtils}.
 */
class NameUtilsTest {

    @Test
    void isPascalCase_andIsCamelCase() {
        assertThat(NameUtils.isPascalCase("LoginPage")).isTrue();
        assertThat(NameUtils.isPascalCase("loginPage")).isFalse();
        assertThat(NameUtils.isPascalCase("Login_Page")).isFalse();
        assertThat(NameUtils.isCamelCase("submitButton")).isTrue();
        assertThat(NameUtils.isCamelCase("SubmitButton")).isFalse();
    }

    @ParameterizedTest
    @CsvSource({
        "login_page, LoginPage, loginPage",
        "loginPage, LoginPage, loginPage",
        "Submit_Button, SubmitButton, submitButton",
        "user-name, UserName, userName"
    })
    void toPascalCase_andToCamelCase_normalizeSeparators(String input, String pascal, String camel) {
        assertThat(NameUtils.toPascalCase(input)).isEqualTo(pascal);
        assertThat(NameUtils.toCamelCase(input)).isEqualTo(camel);
    }

    @Test
    void findSimilar_returnsClosestFirstIgnoringCase() {
        List<String> similar = NameUtils.findSimilar("LoginPag", List.of("HomePage", "LoginPage", "loginpages", "Cart"));

        assertThat(similar).containsExactly("LoginPage", "loginpages");
    }

    @Test
    void findSimilar_skipsExactMatchAndDistantNames() {
        assertThat(NameUtils.findSimilar("login", List.of("login", "checkout"))).isEmpty();
    }

    @Test
    void findSimilar_limitsToThreeSuggestions() {
        List<String> similar = NameUtils.findSimilar("submit", List.of("submit1", "submit2", "submit3", "submit4"));

        assertThat(similar).containsExactly("submit1", "submit2", "submit3");
    }

    @Test
    void levenshtein_countsEdits() {
        assertThat(NameUtils.levenshtein("kitten", "sitting")).isEqualTo(3);
        assertThat(NameUtils.levenshtein("", "abc")).isEqualTo(3);
        assertThat(NameUtils.levenshtein("same", "same")).isZero();
    }
}

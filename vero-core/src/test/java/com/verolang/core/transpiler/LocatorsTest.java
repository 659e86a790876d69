package com.verolang.core.transpiler;

import com.verolang.core.ast.Selector;
import com.verolang.core.ast.SelectorType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Locators}.
 */
class LocatorsTest {

    @ParameterizedTest
    @ValueSource(strings = {"#email", ".btn", "[data-id=\"1\"]", "//div[@id='x']", "/html/body",
        "ul > li", "h1 ~ p", "a + b", "li:nth-child(2)", "input:checked", "div.card", "button#save"})
    void looksLikeCssOrXPath_selectorSyntax_returnsTrue(String value) {
        assertThat(Locators.looksLikeCssOrXPath(value)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"Sign in", "Welcome back!", "Price: 10", "div"})
    void looksLikeCssOrXPath_visibleText_returnsFalse(String value) {
        assertThat(Locators.looksLikeCssOrXPath(value)).isFalse();
    }

    @Test
    void locator_autoSelector_picksCssOrText() {
        assertThat(Locators.locator("page", Selector.auto("#email"))).isEqualTo("page.locator('#email')");
        assertThat(Locators.locator("page", Selector.auto("Sign in"))).isEqualTo("page.getByText('Sign in')");
    }

    @Test
    void locator_roleKinds_useGetByRole() {
        assertThat(Locators.locator("page", Selector.of(SelectorType.BUTTON, "Save")))
            .isEqualTo("page.getByRole('button', { name: 'Save' })");
        assertThat(Locators.locator("page", Selector.of(SelectorType.HEADING, "Orders")))
            .isEqualTo("page.getByRole('heading', { name: 'Orders' })");
        assertThat(Locators.locator("page", new Selector(SelectorType.ROLE, "tab", "Settings", null, 0)))
            .isEqualTo("page.getByRole('tab', { name: 'Settings' })");
        assertThat(Locators.locator("page", Selector.of(SelectorType.ROLE, "dialog")))
            .isEqualTo("page.getByRole('dialog')");
    }

    @Test
    void locator_attributeKinds_useMatchingLookup() {
        assertThat(Locators.locator("this.page", Selector.of(SelectorType.TESTID, "cart")))
            .isEqualTo("this.page.getByTestId('cart')");
        assertThat(Locators.locator("page", Selector.of(SelectorType.LABEL, "Email")))
            .isEqualTo("page.getByLabel('Email')");
        assertThat(Locators.locator("page", Selector.of(SelectorType.PLACEHOLDER, "Search")))
            .isEqualTo("page.getByPlaceholder('Search')");
        assertThat(Locators.locator("page", Selector.of(SelectorType.ALT, "Logo")))
            .isEqualTo("page.getByAltText('Logo')");
        assertThat(Locators.locator("page", Selector.of(SelectorType.TITLE, "Close")))
            .isEqualTo("page.getByTitle('Close')");
        assertThat(Locators.locator("page", Selector.of(SelectorType.TEXT, "#1 seller")))
            .isEqualTo("page.getByText('#1 seller')");
    }

    @Test
    void locator_xpath_addsEnginePrefixOnce() {
        assertThat(Locators.locator("page", Selector.of(SelectorType.XPATH, "//a")))
            .isEqualTo("page.locator('xpath=//a')");
        assertThat(Locators.locator("page", Selector.of(SelectorType.XPATH, "xpath=//a")))
            .isEqualTo("page.locator('xpath=//a')");
    }

    @Test
    void locator_position_narrowsMatch() {
        Selector rows = Selector.auto("tr.item");

        assertThat(Locators.locator("page", rows.withPosition(Selector.Position.FIRST, 0)))
            .isEqualTo("page.locator('tr.item').first()");
        assertThat(Locators.locator("page", rows.withPosition(Selector.Position.LAST, 0)))
            .isEqualTo("page.locator('tr.item').last()");
        assertThat(Locators.locator("page", rows.withPosition(Selector.Position.NTH, 2)))
            .isEqualTo("page.locator('tr.item').nth(2)");
    }

    @Test
    void locator_quotesInValue_areEscaped() {
        assertThat(Locators.locator("__frame1__", Selector.auto("It's done")))
            .isEqualTo("__frame1__.getByText('It\\'s done')");
    }
}

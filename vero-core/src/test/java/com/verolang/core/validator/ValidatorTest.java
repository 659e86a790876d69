package com.verolang.core.validator;

import com.verolang.core.ast.Program;
import com.verolang.core.error.ErrorSuggestion;
import com.verolang.core.error.VeroError;
import com.verolang.core.lexer.Lexer;
import com.verolang.core.parser.ParseResult;
import com.verolang.core.parser.Parser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Validator}.
 */
class ValidatorTest {

    private static final String LOGIN_PAGE = """
        PAGE LoginPage {
          FIELD email = "#email"
          FIELD submit = BUTTON "Sign in"
          TEXT greeting = "Welcome"

          login WITH user {
            FILL email WITH user
            CLICK submit
          }
        }
        """;

    @Test
    void validate_wellFormedProgram_isValidWithoutDiagnostics() {
        ValidationResult result = validate(LOGIN_PAGE + """
            FEATURE Login {
              USE LoginPage
              SCENARIO signIn {
                PERFORM LoginPage.login WITH "a@b.c"
                FILL LoginPage.email WITH "x"
                VERIFY LoginPage.greeting EQUALS "Welcome"
                TEXT name = "Bob"
                LOG name
              }
            }
            """);

        assertThat(result.valid()).isTrue();
        assertThat(result.all()).isEmpty();
    }

    @Test
    void validate_duplicatePage_reportsDuplicateDefinition() {
        ValidationResult result = validate("""
            PAGE Home {
              FIELD title = "h1"
            }
            PAGE Home {
              FIELD logo = "#logo"
            }
            """);

        assertThat(codes(result.errors())).containsExactly("VERO-100");
        assertThat(result.errors().get(0).whatWentWrong()).contains("'Home'");
        assertThat(result.errors().get(0).line()).isEqualTo(4);
    }

    @Test
    void validate_duplicateScenarioInFeature_reportsDuplicateDefinition() {
        ValidationResult result = validate("""
            FEATURE Shop {
              SCENARIO "Checkout" {
                LOG "first"
              }
              SCENARIO "Checkout" {
                LOG "second"
              }
            }
            FEATURE Account {
              SCENARIO "Checkout" {
                LOG "other feature"
              }
            }
            """);

        assertThat(codes(result.errors())).containsExactly("VERO-100");
        assertThat(result.errors().get(0).whatWentWrong())
            .isEqualTo("Duplicate scenario 'Checkout' in feature 'Shop'");
        assertThat(result.errors().get(0).line()).isEqualTo(5);
    }

    @Test
    void validate_pageAlsoDefinedInContext_reportsDuplicateDefinition() {
        ValidationContext context = ValidationContext.of(List.of(parse(LOGIN_PAGE)));

        ValidationResult result = Validator.validate(parse(LOGIN_PAGE), context);

        assertThat(codes(result.errors())).containsExactly("VERO-100");
    }

    @Test
    void validate_pageFromContext_resolvesUseAndActions() {
        ValidationContext context = ValidationContext.of(List.of(parse(LOGIN_PAGE)));
        Program feature = parse("""
            FEATURE Login {
              USE LoginPage
              SCENARIO signIn {
                PERFORM LoginPage.login WITH "a@b.c"
                CLICK LoginPage.submit
              }
            }
            """);

        ValidationResult result = Validator.validate(feature, context);

        assertThat(result.valid()).isTrue();
        assertThat(result.all()).isEmpty();
    }

    @Test
    void validate_useOfUnknownName_reportsUnresolvedUseWithSuggestion() {
        ValidationResult result = validate(LOGIN_PAGE + """
            FEATURE Login {
              USE LoginPag
            }
            """);

        assertThat(codes(result.errors())).containsExactly("VERO-200");
        assertThat(result.errors().get(0).suggestions())
            .extracting(ErrorSuggestion::text)
            .containsExactly("Did you mean 'LoginPage'?");
    }

    @Test
    void validate_pageNotInUseList_reportsPageNotImported() {
        ValidationResult result = validate(LOGIN_PAGE + """
            FEATURE Login {
              SCENARIO signIn {
                CLICK LoginPage.submit
                CLICK Checkout.pay
              }
            }
            """);

        assertThat(codes(result.errors())).containsExactly("VERO-201", "VERO-201");
        assertThat(result.errors().get(0).whatWentWrong()).contains("is used but not in the USE list");
        assertThat(result.errors().get(1).whatWentWrong()).contains("is not defined or imported");
    }

    @Test
    void validate_unknownAction_reportsUndefinedActionWithSuggestion() {
        ValidationResult result = validate(LOGIN_PAGE + """
            FEATURE Login {
              USE LoginPage
              SCENARIO signIn {
                PERFORM LoginPage.logn WITH "a@b.c"
              }
            }
            """);

        assertThat(codes(result.errors())).containsExactly("VERO-202");
        assertThat(result.errors().get(0).suggestions())
            .extracting(ErrorSuggestion::text)
            .contains("Did you mean 'login'?");
    }

    @Test
    void validate_unqualifiedActionFromUsedPage_resolves() {
        ValidationResult result = validate(LOGIN_PAGE + """
            FEATURE Login {
              USE LoginPage
              SCENARIO signIn {
                DO login WITH "a@b.c"
              }
            }
            """);

        assertThat(result.errors()).isEmpty();
    }

    @Test
    void validate_wrongArgumentCount_reportsExpectedAndActual() {
        ValidationResult result = validate(LOGIN_PAGE + """
            FEATURE Login {
              USE LoginPage
              SCENARIO signIn {
                PERFORM LoginPage.login
              }
            }
            """);

        assertThat(codes(result.errors())).containsExactly("VERO-208");
        VeroError error = result.errors().get(0);
        assertThat(error.expectedValue()).isEqualTo("1");
        assertThat(error.actualValue()).isEqualTo("0");
    }

    @Test
    void validate_forEachOverUnloadedCollection_reportsUndefinedCollection() {
        ValidationResult result = validate("""
            FEATURE Data {
              SCENARIO loop {
                FOR EACH user IN users {
                  LOG user
                }
              }
            }
            """);

        assertThat(codes(result.errors())).containsExactly("VERO-203");
    }

    @Test
    void validate_forEachOverLoadedRows_isValid() {
        ValidationResult result = validate("""
            FEATURE Data {
              SCENARIO loop {
                ROWS users = Users WHERE active = true
                FOR EACH user IN users {
                  LOG user.email
                }
              }
            }
            """);

        assertThat(result.all()).isEmpty();
    }

    @Test
    void validate_unknownVariableAndField_areWarningsOnly() {
        ValidationResult result = validate(LOGIN_PAGE + """
            FEATURE Login {
              USE LoginPage
              SCENARIO signIn {
                LOG missing
                CLICK LoginPage.sbmit
              }
            }
            """);

        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(codes(result.warnings())).containsExactly("VERO-204", "VERO-205");
        assertThat(result.warnings().get(1).suggestions())
            .extracting(ErrorSuggestion::text)
            .contains("Did you mean 'submit'?");
    }

    @Test
    void validate_pageActionsForUnknownPage_reportsInvalidTarget() {
        ValidationResult result = validate("""
            PAGEACTIONS CheckoutActions FOR Checkout {
              pay {
                REFRESH
              }
            }
            """);

        assertThat(codes(result.errors())).containsExactly("VERO-206");
    }

    @Test
    void validate_tabOperations_onlyAllowedWherePageIsPerTest() {
        ValidationResult result = validate("""
            PAGE Shop {
              FIELD cart = "#cart"

              popOut {
                SWITCH TO NEW TAB
              }
            }
            FEATURE Tabs {
              USE Shop
              BEFORE ALL {
                SWITCH TO TAB 1
              }
              BEFORE EACH {
                OPEN "/help" IN NEW TAB
              }
              SCENARIO tabs {
                SWITCH TO NEW TAB "/cart"
                CLOSE TAB
              }
            }
            """);

        assertThat(codes(result.errors())).containsExactly("VERO-207", "VERO-207");
        assertThat(result.errors()).extracting(VeroError::whatWentWrong)
            .containsExactly(
                "Tab operations are not allowed in action definitions",
                "Tab operations are not allowed in BEFORE ALL and AFTER ALL hooks");
    }

    @Test
    void validate_namingConventions_areWarnings() {
        ValidationResult result = validate("""
            PAGE loginPage {
              FIELD Email = "#email"
            }
            """);

        assertThat(result.valid()).isTrue();
        assertThat(codes(result.warnings())).containsExactlyInAnyOrder("VERO-210", "VERO-210");
        assertThat(result.warnings()).extracting(VeroError::howToFix)
            .containsExactlyInAnyOrder("Rename it to 'LoginPage'.", "Rename it to 'email'.");
    }

    @Test
    void validate_nullProgram_throwsNullPointerException() {
        assertThatThrownBy(() -> Validator.validate(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("program");
    }

    private static Program parse(String source) {
        ParseResult result = Parser.parse(Lexer.tokenize(source).tokens());
        assertThat(result.errors()).isEmpty();
        return result.program();
    }

    private static ValidationResult validate(String source) {
        return Validator.validate(parse(source));
    }

    private static List<String> codes(List<VeroError> errors) {
        return errors.stream().map(VeroError::code).toList();
    }
}

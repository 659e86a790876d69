package com.verolang.core;

import com.verolang.core.ast.Program;
import com.verolang.core.error.VeroError;
import com.verolang.core.parser.ParseResult;
import com.verolang.core.selection.ScenarioSelection;
import com.verolang.core.selection.ScenarioSelectionException;
import com.verolang.core.transpiler.TranspileOptions;
import com.verolang.core.validator.ValidationContext;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link VeroCompiler}.
 */
class VeroCompilerTest {

    private static final String LOGIN_PAGE = """
        PAGE LoginPage {
          FIELD email = "#email"
          FIELD submit = BUTTON "Sign in"

          login WITH user {
            FILL email WITH user
            CLICK submit
          }
        }
        """;

    private static final String LOGIN_FEATURE = """
        FEATURE Login {
          USE LoginPage

          SCENARIO "valid login" @smoke {
            PERFORM LoginPage.login WITH "a@b.c"
          }

          SCENARIO "locked account" @regression {
            PERFORM LoginPage.login WITH "locked@b.c"
          }
        }
        """;

    @Test
    void compile_validSource_returnsGeneratedCode() {
        CompileResult result = VeroCompiler.compile(LOGIN_PAGE + LOGIN_FEATURE);

        assertThat(result.success()).isTrue();
        assertThat(result.stage()).isEqualTo(CompileResult.Stage.TRANSPILE);
        assertThat(result.errors()).isEmpty();
        assertThat(result.code())
            .contains("class LoginPage {")
            .contains("test.describe('Login', () => {")
            .contains("test('valid login @smoke'");
        assertThat(result.result().selectedScenarios()).isEqualTo(2);
    }

    @Test
    void compile_lexerError_stopsAtLexStage() {
        CompileResult result = VeroCompiler.compile("PAGE Home {\n  FIELD title = \"h1\n}");

        assertThat(result.success()).isFalse();
        assertThat(result.stage()).isEqualTo(CompileResult.Stage.LEX);
        assertThat(result.code()).isNull();
        assertThat(result.errors()).extracting(VeroError::code).contains("VERO-102");
    }

    @Test
    void compile_syntaxError_stopsAtParseStage() {
        CompileResult result = VeroCompiler.compile("""
            FEATURE Login {
              SCENARIO first {
                FLY "away"
              }
            }
            """);

        assertThat(result.success()).isFalse();
        assertThat(result.stage()).isEqualTo(CompileResult.Stage.PARSE);
        assertThat(result.errors()).extracting(VeroError::code).containsExactly("VERO-303");
    }

    @Test
    void compile_unknownPage_stopsAtValidateStage() {
        CompileResult result = VeroCompiler.compile("""
            FEATURE Login {
              USE MissingPage
              SCENARIO first {
                REFRESH
              }
            }
            """);

        assertThat(result.success()).isFalse();
        assertThat(result.stage()).isEqualTo(CompileResult.Stage.VALIDATE);
        assertThat(result.errors()).extracting(VeroError::code).containsExactly("VERO-200");
    }

    @Test
    void compile_warningsOnly_stillGeneratesCode() {
        CompileResult result = VeroCompiler.compile(LOGIN_PAGE + """
            FEATURE Login {
              USE LoginPage
              SCENARIO first {
                CLICK LoginPage.missing
              }
            }
            """);

        assertThat(result.success()).isTrue();
        assertThat(result.warnings()).extracting(VeroError::code).containsExactly("VERO-205");
        assertThat(result.code()).isNotBlank();
    }

    @Test
    void compile_withContextPages_resolvesAndEmitsThem() {
        Program pages = VeroCompiler.parse(LOGIN_PAGE).program();
        CompileOptions options = CompileOptions.defaults()
            .withContext(ValidationContext.of(List.of(pages)));

        CompileResult result = VeroCompiler.compile(LOGIN_FEATURE, options);

        assertThat(result.success()).isTrue();
        assertThat(result.code()).contains("class LoginPage {");
    }

    @Test
    void compile_withTagSelection_keepsMatchingScenarios() {
        CompileOptions options = CompileOptions.defaults().withTranspile(
            TranspileOptions.defaults().withSelection(ScenarioSelection.byTagExpression("@regression")));

        CompileResult result = VeroCompiler.compile(LOGIN_PAGE + LOGIN_FEATURE, options);

        assertThat(result.success()).isTrue();
        assertThat(result.result().selectedScenarios()).isEqualTo(1);
        assertThat(result.code())
            .contains("test('locked account @regression'")
            .doesNotContain("valid login");
    }

    @Test
    void compile_malformedTagExpression_throws() {
        assertThatThrownBy(() -> VeroCompiler.compile(LOGIN_PAGE + LOGIN_FEATURE, CompileOptions.defaults()
            .withTranspile(TranspileOptions.defaults()
                .withSelection(ScenarioSelection.byTagExpression("@smoke and")))))
            .isInstanceOf(ScenarioSelectionException.class);
    }

    @Test
    void parse_lexerErrors_returnEmptyProgram() {
        ParseResult result = VeroCompiler.parse("FILL email WITH \"oops");

        assertThat(result.hasErrors()).isTrue();
        assertThat(result.program()).isEqualTo(Program.empty());
    }

    @Test
    void compile_nullSource_throws() {
        assertThatThrownBy(() -> VeroCompiler.compile(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessage("source must not be null");
    }
}

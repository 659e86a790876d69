package com.verolang.core.lexer;

import com.verolang.core.error.VeroError;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Lexer}.
 */
class LexerTest {

    @Test
    void tokenize_keywordsIgnoreCase_returnsKeywordTokens() {
        LexResult result = Lexer.tokenize("page LoginPage {\n  Field email = \"#email\"\n}");

        assertThat(result.hasErrors()).isFalse();
        assertThat(types(result)).containsExactly(
            TokenType.PAGE, TokenType.IDENTIFIER, TokenType.LBRACE,
            TokenType.FIELD, TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.STRING,
            TokenType.RBRACE, TokenType.EOF);
        assertThat(result.tokens().get(1).value()).isEqualTo("LoginPage");
    }

    @Test
    void tokenize_trackLinesAndColumns() {
        LexResult result = Lexer.tokenize("CLICK submit\n  FILL email WITH \"x\"");

        Token fill = result.tokens().get(2);
        assertThat(fill.type()).isEqualTo(TokenType.FILL);
        assertThat(fill.line()).isEqualTo(2);
        assertThat(fill.column()).isEqualTo(3);
    }

    @Test
    void tokenize_stringEscapes_areDecoded() {
        LexResult result = Lexer.tokenize("'it\\'s' \"line\\nbreak\" \"tab\\there\"");

        assertThat(result.hasErrors()).isFalse();
        assertThat(result.tokens()).extracting(Token::value)
            .startsWith("it's", "line\nbreak", "tab\there");
    }

    @Test
    void tokenize_envReference_returnsEnvVarToken() {
        LexResult result = Lexer.tokenize("OPEN {{ BASE_URL }}");

        assertThat(result.hasErrors()).isFalse();
        Token env = result.tokens().get(1);
        assertThat(env.type()).isEqualTo(TokenType.ENV_VAR);
        assertThat(env.value()).isEqualTo("BASE_URL");
    }

    @Test
    void tokenize_comments_areKeptAsCommentTokens() {
        LexResult result = Lexer.tokenize("# header note\nCLICK x // trailing");

        assertThat(types(result)).containsExactly(
            TokenType.COMMENT, TokenType.CLICK, TokenType.IDENTIFIER, TokenType.COMMENT, TokenType.EOF);
        assertThat(result.tokens().get(0).value()).isEqualTo("header note");
        assertThat(result.tokens().get(3).value()).isEqualTo("trailing");
    }

    @Test
    void tokenize_numbers_acceptNegativeAndDecimal() {
        LexResult result = Lexer.tokenize("42 -3 2.5");

        assertThat(result.tokens()).extracting(Token::type)
            .startsWith(TokenType.NUMBER_LITERAL, TokenType.NUMBER_LITERAL, TokenType.NUMBER_LITERAL);
        assertThat(result.tokens()).extracting(Token::value).startsWith("42", "-3", "2.5");
    }

    @Test
    void tokenize_operators_returnComparisonTokens() {
        LexResult result = Lexer.tokenize("= == != > < >= <=");

        assertThat(types(result)).containsExactly(
            TokenType.ASSIGN, TokenType.EQ, TokenType.NEQ, TokenType.GT, TokenType.LT,
            TokenType.GTE, TokenType.LTE, TokenType.EOF);
    }

    @Test
    void tokenize_unexpectedCharacter_reportsErrorAndContinues() {
        LexResult result = Lexer.tokenize("CLICK $ submit");

        assertThat(codes(result.errors())).containsExactly("VERO-101");
        assertThat(types(result)).containsExactly(TokenType.CLICK, TokenType.IDENTIFIER, TokenType.EOF);
    }

    @Test
    void tokenize_unterminatedString_reportsError() {
        LexResult result = Lexer.tokenize("FILL email WITH \"oops\nCLICK submit");

        assertThat(codes(result.errors())).containsExactly("VERO-102");
        assertThat(result.errors().get(0).line()).isEqualTo(1);
        assertThat(types(result)).contains(TokenType.CLICK);
    }

    @Test
    void tokenize_invalidNumber_reportsError() {
        LexResult result = Lexer.tokenize("WAIT 12abc SECONDS");

        assertThat(codes(result.errors())).containsExactly("VERO-103");
    }

    @Test
    void tokenize_invalidEnvName_reportsUnknownToken() {
        LexResult result = Lexer.tokenize("OPEN {{1abc}}");

        assertThat(codes(result.errors())).containsExactly("VERO-104");
    }

    @Test
    void tokenize_unterminatedEnvReference_reportsError() {
        LexResult result = Lexer.tokenize("OPEN {{BASE_URL\nCLICK x");

        assertThat(codes(result.errors())).contains("VERO-105");
        assertThat(types(result)).contains(TokenType.CLICK);
    }

    @Test
    void tokenize_alwaysEndsWithEof() {
        assertThat(Lexer.tokenize("").tokens()).extracting(Token::type).containsExactly(TokenType.EOF);
    }

    @Test
    void tokenize_nullSource_throwsException() {
        assertThatThrownBy(() -> Lexer.tokenize(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("source");
    }

    @Test
    void tokenize_keywordPrefix_staysIdentifier() {
        LexResult result = Lexer.tokenize("count checkout Hidden");

        assertThat(types(result)).containsExactly(
            TokenType.COUNT, TokenType.IDENTIFIER, TokenType.HIDDEN_STATE, TokenType.EOF);
        assertThat(result.tokens().get(2).value()).isEqualTo("Hidden");
    }

    @Test
    void grammarType_everyParserVisibleKind_mapsBothWays() {
        for (TokenType type : TokenType.values()) {
            if (type == TokenType.COMMENT) {
                assertThatThrownBy(type::grammarType).isInstanceOf(IllegalStateException.class);
            } else {
                assertThat(TokenType.fromGrammar(type.grammarType())).isEqualTo(type);
            }
        }
    }

    private static List<TokenType> types(LexResult result) {
        return result.tokens().stream().map(Token::type).toList();
    }

    private static List<String> codes(List<VeroError> errors) {
        return errors.stream().map(VeroError::code).toList();
    }
}

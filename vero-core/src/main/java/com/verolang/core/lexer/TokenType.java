package com.verolang.core.lexer;

import com.verolang.core.grammar.VeroLexer;
import org.antlr.v4.runtime.Vocabulary;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Token kinds produced by the {@link Lexer}.
 *
 * <p>Every constant except {@link #COMMENT} and {@link #EOF} has a token of the same name in the
 * Vero grammar; {@link #fromGrammar(int)} and {@link #grammarType()} translate between the two.
 * Keyword constants match their name case-insensitively. Which keywords are reserved and which
 * may double as names is decided by the grammar.
 */
public enum TokenType {

    // Structure
    PAGE, PAGEACTIONS, FEATURE, SCENARIO, FIELD, USE, BEFORE, AFTER, ALL, EACH, WITH, FROM, TO, IN, FOR, OF, AS,
    RETURNS, RETURN, IF, ELSE, REPEAT, TIMES, TRUE, FALSE, NULL,

    // Actions
    CLICK, DOUBLE, RIGHT, FORCE, FILL, OPEN, CHECK, UNCHECK, SELECT, HOVER, PRESS, SCROLL, UP, DOWN, LEFT, DRAG,
    UPLOAD, WAIT, SECONDS, MILLISECONDS, NAVIGATION, NETWORK, IDLE, DO, PERFORM, REFRESH, CLEAR, TAKE, SCREENSHOT,
    LOG, SWITCH, NEW, TAB, FRAME, MAIN, CLOSE, ACCEPT, DISMISS, DIALOG, SET, GET, COOKIE, COOKIES, STORAGE,

    // Assertions. HIDDEN is a reserved token name in ANTLR lexers, hence the suffix.
    VERIFY, IS, NOT, VISIBLE, HIDDEN_STATE, ENABLED, DISABLED, CHECKED, FOCUSED, EMPTY, CONTAINS, EQUALS, MATCHES,
    HAS, VALUE, ATTRIBUTE, COUNT, CLASS, URL, TITLE,

    // Variable types
    TEXT, NUMBER, FLAG, LIST,

    // Selector kinds
    BUTTON, TEXTBOX, LINK, CHECKBOX, HEADING, TESTID, ROLE, NAME, LABEL, PLACEHOLDER, ALT, CSS, XPATH, NTH, FIRST,
    LAST,

    // Data queries
    LOAD, ROW, ROWS, WHERE, AND, OR, ORDER, BY, ASC, DESC, LIMIT, OFFSET, RANDOM, SUM, AVERAGE, MIN, MAX, DISTINCT,
    STARTS, ENDS,

    // Literals
    IDENTIFIER, STRING, NUMBER_LITERAL, ENV_VAR,

    // Punctuation and operators
    LBRACE, RBRACE, LPAREN, RPAREN, LBRACKET, RBRACKET, COMMA, DOT, AT, ASSIGN, EQ, NEQ, GT, LT, GTE, LTE,

    COMMENT,
    EOF;

    private static final Map<TokenType, Integer> GRAMMAR_TYPES;

    private static final TokenType[] BY_GRAMMAR_TYPE;

    static {
        Vocabulary vocabulary = VeroLexer.VOCABULARY;
        Map<TokenType, Integer> grammarTypes = new EnumMap<>(TokenType.class);
        BY_GRAMMAR_TYPE = new TokenType[vocabulary.getMaxTokenType() + 1];
        for (TokenType type : values()) {
            for (int i = 1; i <= vocabulary.getMaxTokenType(); i++) {
                if (type.name().equals(vocabulary.getSymbolicName(i))) {
                    grammarTypes.put(type, i);
                    BY_GRAMMAR_TYPE[i] = type;
                }
            }
        }
        grammarTypes.put(EOF, org.antlr.v4.runtime.Token.EOF);
        GRAMMAR_TYPES = Collections.unmodifiableMap(grammarTypes);
    }

    /**
     * Token type of this kind in the generated grammar.
     *
     * @throws IllegalStateException for {@link #COMMENT}, which the parser never sees
     */
    public int grammarType() {
        Integer type = GRAMMAR_TYPES.get(this);
        if (type == null) {
            throw new IllegalStateException(name() + " has no grammar token");
        }
        return type;
    }

    /**
     * Looks up the kind of a grammar token.
     *
     * @param grammarType token type from the generated lexer
     * @return the matching kind, or {@code null} for grammar-only tokens such as error tokens
     */
    public static TokenType fromGrammar(int grammarType) {
        if (grammarType == org.antlr.v4.runtime.Token.EOF) {
            return EOF;
        }
        if (grammarType < 0 || grammarType >= BY_GRAMMAR_TYPE.length) {
            return null;
        }
        return BY_GRAMMAR_TYPE[grammarType];
    }
}

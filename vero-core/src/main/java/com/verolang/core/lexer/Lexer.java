package com.verolang.core.lexer;

import com.verolang.core.error.LexerErrors;
import com.verolang.core.error.VeroError;
import com.verolang.core.grammar.VeroLexer;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns Vero source text into {@link Token}s using the generated {@link VeroLexer}.
 *
 * <p>The lexer never aborts: the grammar has a token for every malformed input (unterminated
 * strings and references, numbers running into letters, stray characters) and each one is
 * recorded as a {@link VeroError} while scanning continues. Comments are kept as
 * {@link TokenType#COMMENT} tokens.
 */
public final class Lexer {

    private static final Logger log = LoggerFactory.getLogger(Lexer.class);

    private static final Pattern ENV_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final Pattern NUMBER_PREFIX = Pattern.compile("-?\\d+(\\.\\d+)?");

    private final List<Token> tokens = new ArrayList<>();
    private final List<VeroError> errors = new ArrayList<>();

    private Lexer() {
    }

    /**
     * Scans {@code source} into tokens.
     *
     * @param source Vero source text
     * @return tokens ending with {@code EOF} plus any lexical errors
     */
    public static LexResult tokenize(String source) {
        Objects.requireNonNull(source, "source must not be null");
        Lexer lexer = new Lexer();
        lexer.scan(source);
        log.debug("Tokenized {} characters into {} tokens ({} errors)",
            source.length(), lexer.tokens.size(), lexer.errors.size());
        return new LexResult(lexer.tokens, lexer.errors);
    }

    private void scan(String source) {
        VeroLexer lexer = new VeroLexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(new BaseErrorListener() {
            @Override
            public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                    int charPositionInLine, String msg, RecognitionException e) {
                char offending = charPositionInLine < 0 ? '?' : characterAt(source, line, charPositionInLine);
                errors.add(LexerErrors.unexpectedCharacter(offending, line, charPositionInLine + 1));
            }
        });

        org.antlr.v4.runtime.Token token = lexer.nextToken();
        while (token.getType() != org.antlr.v4.runtime.Token.EOF) {
            convert(token);
            token = lexer.nextToken();
        }
        tokens.add(new Token(TokenType.EOF, "", token.getLine(), token.getCharPositionInLine() + 1));
    }

    private void convert(org.antlr.v4.runtime.Token token) {
        String text = token.getText();
        int line = token.getLine();
        int column = token.getCharPositionInLine() + 1;

        switch (token.getType()) {
            case VeroLexer.STRING -> add(TokenType.STRING, unescape(text.substring(1, text.length() - 1)), line, column);
            case VeroLexer.UNTERMINATED_STRING -> {
                errors.add(LexerErrors.unterminatedString(line, column));
                add(TokenType.STRING, unescape(text.substring(1)), line, column);
            }
            case VeroLexer.INVALID_NUMBER -> {
                errors.add(LexerErrors.invalidNumber(text, line, column));
                Matcher prefix = NUMBER_PREFIX.matcher(text);
                if (prefix.lookingAt()) {
                    add(TokenType.NUMBER_LITERAL, prefix.group(), line, column);
                }
            }
            case VeroLexer.ENV_VAR -> {
                String name = text.substring(2, text.length() - 2).trim();
                if (ENV_NAME.matcher(name).matches()) {
                    add(TokenType.ENV_VAR, name, line, column);
                } else {
                    errors.add(LexerErrors.unknownToken("{{" + name + "}}", line, column));
                }
            }
            case VeroLexer.UNTERMINATED_ENV -> errors.add(LexerErrors.unterminatedReference(line, column));
            case VeroLexer.UNEXPECTED_CHAR -> errors.add(LexerErrors.unexpectedCharacter(text.charAt(0), line, column));
            case VeroLexer.COMMENT -> {
                int prefix = text.startsWith("#") ? 1 : 2;
                add(TokenType.COMMENT, text.substring(prefix).trim(), line, column);
            }
            default -> {
                TokenType type = TokenType.fromGrammar(token.getType());
                if (type == null) {
                    throw new IllegalStateException("No token kind for grammar token "
                        + VeroLexer.VOCABULARY.getSymbolicName(token.getType()));
                }
                add(type, text, line, column);
            }
        }
    }

    private void add(TokenType type, String value, int line, int column) {
        tokens.add(new Token(type, value, line, column));
    }

    /**
     * Decodes {@code \n} and {@code \t}; any other escaped character stands for itself. A
     * trailing lone backslash is kept.
     */
    private static String unescape(String raw) {
        if (raw.indexOf('\\') < 0) {
            return raw;
        }
        StringBuilder value = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '\\' && i + 1 < raw.length()) {
                char escaped = raw.charAt(++i);
                value.append(switch (escaped) {
                    case 'n' -> '\n';
                    case 't' -> '\t';
                    default -> escaped;
                });
            } else {
                value.append(c);
            }
        }
        return value.toString();
    }

    private static char characterAt(String source, int line, int charPositionInLine) {
        String[] lines = source.split("\n", -1);
        if (line < 1 || line > lines.length || charPositionInLine >= lines[line - 1].length()) {
            return '?';
        }
        return lines[line - 1].charAt(charPositionInLine);
    }
}

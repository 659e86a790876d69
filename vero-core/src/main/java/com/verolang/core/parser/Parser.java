package com.verolang.core.parser;

import com.verolang.core.ast.Program;
import com.verolang.core.error.VeroError;
import com.verolang.core.grammar.VeroParser;
import com.verolang.core.lexer.Token;
import com.verolang.core.lexer.TokenType;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ListTokenSource;
import org.antlr.v4.runtime.TokenSource;
import org.antlr.v4.runtime.misc.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses lexer tokens into a {@link Program} with the generated {@link VeroParser}.
 *
 * <p>Line breaks end statements. The lexer drops them, so an {@code NL} token is inserted
 * wherever two consecutive tokens sit on different lines; a statement therefore never takes its
 * operands from the following line.
 *
 * <p>Syntax errors are collected rather than thrown. A failing statement or member records one
 * {@link VeroError} and is left out of the program; parsing resumes on the next line. A failing
 * declaration header resumes at the next top-level declaration.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * ParseResult result = Parser.parse(Lexer.tokenize(source).tokens());
 * if (!result.hasErrors()) {
 *     Program program = result.program();
 * }
 * }</pre>
 */
public final class Parser {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private Parser() {
    }

    /**
     * Parses a token list produced by the lexer. Comment tokens are ignored.
     *
     * @param source tokens, normally ending with {@code EOF}
     * @return the program and all syntax errors
     */
    public static ParseResult parse(List<Token> source) {
        Objects.requireNonNull(source, "tokens must not be null");
        List<VeroError> errors = new ArrayList<>();

        VeroParser parser = new VeroParser(new CommonTokenStream(tokenSource(source)));
        parser.removeErrorListeners();
        parser.addErrorListener(new SyntaxErrorListener(errors));
        parser.setErrorHandler(new LineRecoveryStrategy());

        VeroParser.ProgramContext tree = parser.program();
        Program program = new AstBuilder(errors).program(tree);
        log.debug("Parsed {} pages, {} page actions, {} features ({} errors)",
            program.pages().size(), program.pageActions().size(), program.features().size(), errors.size());
        return new ParseResult(program, errors);
    }

    private static TokenSource tokenSource(List<Token> source) {
        List<CommonToken> grammarTokens = new ArrayList<>();
        ListTokenSource tokenSource = new ListTokenSource(grammarTokens);
        Pair<TokenSource, CharStream> origin = new Pair<>(tokenSource, null);

        Token previous = null;
        for (Token token : source) {
            if (token.type() == TokenType.COMMENT) {
                continue;
            }
            if (token.type() == TokenType.EOF) {
                break;
            }
            if (previous != null && previous.line() != token.line()) {
                grammarTokens.add(lineBreak(origin, previous));
            }
            grammarTokens.add(grammarToken(origin, token.type().grammarType(), token.value(),
                token.line(), token.column()));
            previous = token;
        }

        Token end = source.isEmpty() ? null : source.get(source.size() - 1);
        int endLine = end != null && end.type() == TokenType.EOF ? end.line() : lastLine(previous);
        int endColumn = end != null && end.type() == TokenType.EOF ? end.column() : 1;
        grammarTokens.add(grammarToken(origin, org.antlr.v4.runtime.Token.EOF, "<EOF>", endLine, endColumn));
        return tokenSource;
    }

    /**
     * The line break after {@code previous}, placed just past its last character.
     */
    private static CommonToken lineBreak(Pair<TokenSource, CharStream> origin,
                                         Token previous) {
        int width = switch (previous.type()) {
            case STRING -> previous.value().length() + 2;
            case ENV_VAR -> previous.value().length() + 4;
            default -> previous.value().length();
        };
        return grammarToken(origin, VeroParser.NL, "\n", previous.line(), previous.column() + width);
    }

    private static CommonToken grammarToken(Pair<TokenSource, CharStream> origin,
                                            int type, String text, int line, int column) {
        CommonToken token = new CommonToken(origin, type, org.antlr.v4.runtime.Token.DEFAULT_CHANNEL, -1, -1);
        token.setText(text);
        token.setLine(line);
        token.setCharPositionInLine(column - 1);
        return token;
    }

    private static int lastLine(Token previous) {
        return previous == null ? 1 : previous.line();
    }
}

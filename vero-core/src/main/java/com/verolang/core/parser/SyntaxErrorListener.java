package com.verolang.core.parser;

import com.verolang.core.error.ParserErrors;
import com.verolang.core.error.VeroError;
import com.verolang.core.grammar.VeroParser;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.TokenStream;
import org.antlr.v4.runtime.misc.IntervalSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Translates ANTLR syntax errors into Vero diagnostics (VERO-301 to VERO-307).
 *
 * <p>The error code is chosen from what the parser expected at the failing token: a brace, a
 * statement, a quoted string, a name, a keyword or some other token. Errors at end of input are
 * reported once, however many open constructs they leave unfinished.
 */
final class SyntaxErrorListener extends BaseErrorListener {

    private static final String TARGET = "a target (a field name or a quoted selector)";
    private static final String VALUE = "a value (text, number, variable or {{ENV}})";
    private static final String SELECTOR = "a selector such as \"#id\" or BUTTON \"Save\"";

    /** Keywords that only start declarations and members, never a statement. */
    private static final Set<Integer> BLOCK_CLOSERS = Set.of(
        VeroParser.PAGE, VeroParser.PAGEACTIONS, VeroParser.FEATURE, VeroParser.AT,
        VeroParser.SCENARIO, VeroParser.USE, VeroParser.FIELD);

    private final List<VeroError> errors;
    private boolean endOfInputReported;

    SyntaxErrorListener(List<VeroError> errors) {
        this.errors = errors;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                            int charPositionInLine, String msg, RecognitionException e) {
        Parser parser = (Parser) recognizer;
        Token offending = (Token) offendingSymbol;
        IntervalSet expected = e != null ? e.getExpectedTokens() : parser.getExpectedTokens();
        ParserRuleContext context = e != null && e.getCtx() instanceof ParserRuleContext ruleContext
            ? ruleContext
            : parser.getContext();
        int column = charPositionInLine + 1;

        if (offending.getType() == Token.EOF) {
            if (!endOfInputReported) {
                endOfInputReported = true;
                errors.add(ParserErrors.incompleteStatement(describeAtEnd(expected, context), line, column));
            }
            return;
        }
        errors.add(classify(parser, offending, expected, context, line, column));
    }

    private VeroError classify(Parser parser, Token offending, IntervalSet expected, ParserRuleContext context,
                               int line, int column) {
        String found = describe(offending);

        if (expected.contains(VeroParser.RBRACE) && closesBlock(parser.getInputStream(), offending)) {
            return ParserErrors.missingBrace("}", found, line, column);
        }
        if (expected.contains(VeroParser.LBRACE)) {
            return ParserErrors.missingBrace("{", found, line, column);
        }
        // Statement keywords double as names in page bodies, so only a name-free set means a block.
        if (expected.contains(VeroParser.CLICK) && expected.contains(VeroParser.VERIFY)
            && !expected.contains(VeroParser.IDENTIFIER)) {
            return ParserErrors.invalidStatement(found, line, column);
        }
        if (expected.contains(VeroParser.PAGE) && expected.contains(VeroParser.FEATURE)) {
            return ParserErrors.unexpectedToken("PAGE, PAGEACTIONS or FEATURE", found, line, column);
        }
        if (context instanceof VeroParser.PageDeclarationContext || context instanceof VeroParser.PageMemberContext) {
            return ParserErrors.unexpectedToken("FIELD, a variable or an action", found, line, column);
        }
        if (context instanceof VeroParser.PageActionsDeclarationContext) {
            return ParserErrors.unexpectedToken("an action", found, line, column);
        }
        if (context instanceof VeroParser.FeatureDeclarationContext && expected.contains(VeroParser.SCENARIO)) {
            return ParserErrors.missingKeyword("USE, BEFORE, AFTER or SCENARIO", found, line, column);
        }

        String ruleDescription = describeRule(context);
        if (ruleDescription != null) {
            return ParserErrors.unexpectedToken(ruleDescription, found, line, column);
        }

        String after = afterPrevious(parser.getInputStream());
        if (expected.contains(VeroParser.IDENTIFIER)) {
            String what = expected.contains(VeroParser.STRING) ? "or a quoted string " + after : after;
            return ParserErrors.missingName(what.strip(), found, line, column);
        }
        if (expected.size() == 1 && expected.contains(VeroParser.STRING)) {
            return ParserErrors.missingString(after, found, line, column);
        }
        if (onlyKeywords(expected)) {
            return ParserErrors.missingKeyword(list(expected), found, line, column);
        }
        return ParserErrors.unexpectedToken(list(expected), found, line, column);
    }

    private static String describeRule(ParserRuleContext context) {
        if (context instanceof VeroParser.TargetContext) {
            return TARGET;
        }
        if (context instanceof VeroParser.ExpressionContext || context instanceof VeroParser.ConditionContext) {
            return VALUE;
        }
        if (context instanceof VeroParser.SelectorExpressionContext
            || context instanceof VeroParser.SelectorBaseContext) {
            return SELECTOR;
        }
        return null;
    }

    private static String describeAtEnd(IntervalSet expected, ParserRuleContext context) {
        if (expected.contains(VeroParser.RBRACE)) {
            return "'}'";
        }
        String ruleDescription = describeRule(context);
        return ruleDescription != null ? ruleDescription : list(expected);
    }

    /**
     * A declaration keyword, or {@code BEFORE}/{@code AFTER} starting a hook, cannot appear
     * inside a block, so meeting one means the enclosing block was never closed.
     */
    private static boolean closesBlock(TokenStream tokens, Token offending) {
        int type = offending.getType();
        if (BLOCK_CLOSERS.contains(type)) {
            return true;
        }
        if (type != VeroParser.BEFORE && type != VeroParser.AFTER) {
            return false;
        }
        int index = offending.getTokenIndex();
        if (index < 0 || index + 1 >= tokens.size()) {
            return false;
        }
        int next = tokens.get(index + 1).getType();
        return next == VeroParser.ALL || next == VeroParser.EACH;
    }

    private static String afterPrevious(TokenStream tokens) {
        Token previous = tokens.LT(-1);
        if (previous == null || previous.getType() == VeroParser.NL) {
            return "";
        }
        String text = isKeyword(previous.getType())
            ? previous.getText().toUpperCase(Locale.ROOT)
            : "'" + previous.getText() + "'";
        return "after " + text;
    }

    private static boolean onlyKeywords(IntervalSet expected) {
        for (int type : expected.toList()) {
            if (type != VeroParser.NL && !isKeyword(type)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isKeyword(int type) {
        return type >= VeroParser.PAGE && type <= VeroParser.ENDS;
    }

    /**
     * Lists expected tokens as "A, B or C", leaving out line breaks.
     */
    static String list(IntervalSet expected) {
        List<String> names = new ArrayList<>();
        for (int type : expected.toList()) {
            if (type != VeroParser.NL) {
                names.add(displayName(type));
            }
        }
        if (names.isEmpty()) {
            return "end of line";
        }
        if (names.size() == 1) {
            return names.get(0);
        }
        return String.join(", ", names.subList(0, names.size() - 1)) + " or " + names.get(names.size() - 1);
    }

    private static String displayName(int type) {
        if (type == Token.EOF) {
            return "end of file";
        }
        if (type == VeroParser.HIDDEN_STATE) {
            return "HIDDEN";
        }
        if (type == VeroParser.STRING) {
            return "a quoted string";
        }
        if (type == VeroParser.NUMBER_LITERAL) {
            return "a number";
        }
        if (type == VeroParser.IDENTIFIER) {
            return "a name";
        }
        if (type == VeroParser.ENV_VAR) {
            return "{{ENV}}";
        }
        String literal = VeroParser.VOCABULARY.getLiteralName(type);
        return literal != null ? literal : VeroParser.VOCABULARY.getSymbolicName(type);
    }

    /**
     * Text shown for the token that was found instead.
     */
    static String describe(Token token) {
        return switch (token.getType()) {
            case Token.EOF -> "end of file";
            case VeroParser.NL -> "end of line";
            case VeroParser.STRING -> "\"" + token.getText() + "\"";
            case VeroParser.ENV_VAR -> "{{" + token.getText() + "}}";
            default -> token.getText();
        };
    }
}

package com.verolang.core.parser;

import com.verolang.core.grammar.VeroParser;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.TokenStream;
import org.antlr.v4.runtime.atn.ATNState;
import org.antlr.v4.runtime.misc.IntervalSet;

import java.util.Set;

/**
 * Error recovery tuned for a line-oriented language.
 *
 * <p>A broken statement, page member or feature member is abandoned up to the end of its line;
 * a broken declaration header is abandoned up to the next {@code PAGE}, {@code PAGEACTIONS},
 * {@code FEATURE} or annotation. Inner rules do not recover on their own: the exception
 * travels up to the nearest statement, member or declaration so that only whole constructs are
 * dropped from the tree.
 *
 * <p>Tokens that cannot start anything inside a block or declaration body are reported once and
 * skipped the same way. Line breaks are never deleted or skipped past to repair a statement.
 */
final class LineRecoveryStrategy extends DefaultErrorStrategy {

    private enum Skip {
        LINE,
        DECLARATION
    }

    /** Tokens that can never appear inside a statement, so line skipping always stops there. */
    private static final Set<Integer> HARD_CLOSERS = Set.of(
        VeroParser.PAGE, VeroParser.PAGEACTIONS, VeroParser.FEATURE, VeroParser.SCENARIO,
        VeroParser.USE, VeroParser.FIELD, VeroParser.AT);

    private static final Set<Integer> DECLARATION_STARTS = Set.of(
        VeroParser.PAGE, VeroParser.PAGEACTIONS, VeroParser.FEATURE);

    private int lastRecoveryIndex = -1;
    private int lastRecoveryState = -1;

    @Override
    public void sync(Parser recognizer) throws RecognitionException {
        ATNState state = recognizer.getInterpreter().atn.states.get(recognizer.getState());
        int lookahead = recognizer.getInputStream().LA(1);
        IntervalSet next = recognizer.getATN().nextTokens(state);
        if (next.contains(lookahead) || next.contains(Token.EPSILON)) {
            super.sync(recognizer);
            return;
        }

        int type = state.getStateType();
        boolean loop = type == ATNState.STAR_LOOP_ENTRY || type == ATNState.STAR_LOOP_BACK;
        if (loop && (next.contains(VeroParser.RBRACE) || next.contains(Token.EOF))) {
            reportUnwantedToken(recognizer);
            skip(recognizer, recognizer.getContext() instanceof VeroParser.ProgramContext
                ? Skip.DECLARATION
                : Skip.LINE);
            return;
        }
        super.sync(recognizer);
    }

    @Override
    public void recover(Parser recognizer, RecognitionException e) {
        ParserRuleContext context = recognizer.getContext();
        Skip skip = recoveryFor(context);
        if (skip == null) {
            throw e;
        }

        TokenStream input = recognizer.getInputStream();
        int index = input.index();
        if (index == lastRecoveryIndex && recognizer.getState() == lastRecoveryState
            && input.LA(1) != Token.EOF) {
            recognizer.consume();
        }
        lastRecoveryIndex = input.index();
        lastRecoveryState = recognizer.getState();
        skip(recognizer, skip);
    }

    @Override
    protected Token singleTokenDeletion(Parser recognizer) {
        if (recognizer.getInputStream().LA(1) == VeroParser.NL) {
            return null;
        }
        return super.singleTokenDeletion(recognizer);
    }

    /**
     * Which rules absorb a failure, and how far they skip. Null means the failure is passed on
     * to the enclosing rule.
     */
    private static Skip recoveryFor(ParserRuleContext context) {
        if (context instanceof VeroParser.StatementContext
            || context instanceof VeroParser.PageMemberContext
            || context instanceof VeroParser.FeatureMemberContext) {
            return Skip.LINE;
        }
        if (context instanceof VeroParser.ActionDeclarationContext
            && context.getParent() instanceof VeroParser.PageActionsDeclarationContext) {
            return Skip.LINE;
        }
        if (context instanceof VeroParser.DeclarationContext || context instanceof VeroParser.ProgramContext) {
            return Skip.DECLARATION;
        }
        return null;
    }

    /**
     * Consumes tokens up to the next recovery point. Brace groups are skipped as a whole when
     * looking for the end of a line.
     */
    private static void skip(Parser recognizer, Skip skip) {
        TokenStream input = recognizer.getInputStream();
        int depth = 0;
        while (true) {
            int type = input.LA(1);
            if (type == Token.EOF) {
                return;
            }
            if (skip == Skip.LINE) {
                if (HARD_CLOSERS.contains(type)) {
                    return;
                }
                if (depth == 0 && (type == VeroParser.NL || type == VeroParser.RBRACE)) {
                    return;
                }
            } else if (DECLARATION_STARTS.contains(type) || (depth == 0 && type == VeroParser.AT)) {
                return;
            }

            if (type == VeroParser.LBRACE) {
                depth++;
            } else if (type == VeroParser.RBRACE && depth > 0) {
                depth--;
            }
            recognizer.consume();
        }
    }
}

package com.verolang.core.parser;

import com.verolang.core.ast.BooleanLiteral;
import com.verolang.core.ast.ComparisonOperator;
import com.verolang.core.ast.Condition;
import com.verolang.core.ast.ElementState;
import com.verolang.core.ast.EnvVarReference;
import com.verolang.core.ast.Expression;
import com.verolang.core.ast.NumberLiteral;
import com.verolang.core.ast.Selector;
import com.verolang.core.ast.SelectorType;
import com.verolang.core.ast.StringLiteral;
import com.verolang.core.ast.Target;
import com.verolang.core.ast.VarType;
import com.verolang.core.ast.VariableReference;
import com.verolang.core.error.ParserErrors;
import com.verolang.core.error.VeroError;
import com.verolang.core.grammar.VeroBaseVisitor;
import com.verolang.core.grammar.VeroParser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Builds values, targets, selectors and {@code IF} conditions.
 *
 * <p>Checks the grammar cannot express (whole numbers, variables instead of selectors) are
 * reported here and abort the enclosing statement with a {@link RejectedConstruct}.
 */
final class ExpressionBuilder extends VeroBaseVisitor<Expression> {

    private static final Pattern WHOLE_NUMBER = Pattern.compile("\\d{1,9}");

    private final List<VeroError> errors;

    ExpressionBuilder(List<VeroError> errors) {
        this.errors = errors;
    }

    Expression expression(VeroParser.ExpressionContext context) {
        return visit(context);
    }

    @Override
    public Expression visitStringExpression(VeroParser.StringExpressionContext context) {
        return new StringLiteral(context.STRING().getText());
    }

    @Override
    public Expression visitNumberExpression(VeroParser.NumberExpressionContext context) {
        return NumberLiteral.of(context.NUMBER_LITERAL().getText());
    }

    @Override
    public Expression visitBooleanExpression(VeroParser.BooleanExpressionContext context) {
        return new BooleanLiteral(context.TRUE() != null);
    }

    @Override
    public Expression visitEnvExpression(VeroParser.EnvExpressionContext context) {
        return new EnvVarReference(context.ENV_VAR().getText());
    }

    @Override
    public Expression visitReferenceExpression(VeroParser.ReferenceExpressionContext context) {
        return reference(context.reference());
    }

    VariableReference reference(VeroParser.ReferenceContext context) {
        List<VeroParser.NameContext> names = context.name();
        if (names.size() == 2) {
            return new VariableReference(name(names.get(0)), name(names.get(1)));
        }
        return new VariableReference(null, name(names.get(0)));
    }

    // Targets and selectors

    Target target(VeroParser.TargetContext context) {
        if (context.selectorExpression() != null) {
            return Target.of(selector(context.selectorExpression()));
        }
        VariableReference reference = reference(context.reference());
        return Target.field(reference.page(), reference.name());
    }

    Selector selector(VeroParser.SelectorExpressionContext context) {
        Selector selector = selectorBase(context.selectorBase());
        VeroParser.SelectorPositionContext position = context.selectorPosition();
        if (position == null) {
            return selector;
        }
        if (position.FIRST() != null) {
            return selector.withPosition(Selector.Position.FIRST, 0);
        }
        if (position.LAST() != null) {
            return selector.withPosition(Selector.Position.LAST, 0);
        }
        return selector.withPosition(Selector.Position.NTH, wholeNumber(position.NUMBER_LITERAL().getSymbol(), "after NTH"));
    }

    private Selector selectorBase(VeroParser.SelectorBaseContext context) {
        if (context instanceof VeroParser.RoleSelectorContext role) {
            String roleName = role.STRING().size() > 1 ? role.STRING(1).getText() : null;
            return new Selector(SelectorType.ROLE, role.STRING(0).getText(), roleName, Selector.Position.ALL, 0);
        }
        if (context instanceof VeroParser.TypedSelectorContext typed) {
            SelectorType type = SelectorType.valueOf(symbolicName(typed.selectorKind().getStart()));
            return Selector.of(type, typed.STRING().getText());
        }
        return Selector.auto(((VeroParser.AutoSelectorContext) context).STRING().getText());
    }

    // Conditions

    Condition condition(VeroParser.ConditionContext context) {
        if (context instanceof VeroParser.SelectorStateConditionContext selectorState) {
            return new Condition.ElementStateCondition(Target.of(selector(selectorState.selectorExpression())),
                selectorState.NOT() != null, elementState(selectorState.elementState()));
        }
        if (context instanceof VeroParser.BooleanConditionContext bool) {
            ComparisonOperator operator = bool.NOT() != null ? ComparisonOperator.NOT_EQUAL : ComparisonOperator.EQUAL;
            return new Condition.Comparison(expression(bool.expression()), operator,
                new BooleanLiteral(bool.TRUE() != null));
        }
        if (context instanceof VeroParser.ExpressionStateConditionContext expressionState) {
            Target target = targetOf(expressionState.expression());
            return new Condition.ElementStateCondition(target, expressionState.NOT() != null,
                elementState(expressionState.elementState()));
        }
        VeroParser.ComparisonConditionContext comparison = (VeroParser.ComparisonConditionContext) context;
        return new Condition.Comparison(expression(comparison.expression(0)),
            comparisonOperator(comparison.comparisonOperator()), expression(comparison.expression(1)));
    }

    private Target targetOf(VeroParser.ExpressionContext context) {
        Expression expression = expression(context);
        if (expression instanceof VariableReference reference) {
            return Target.field(reference.page(), reference.name());
        }
        if (expression instanceof StringLiteral literal) {
            return Target.of(Selector.auto(literal.value()));
        }
        throw reject(context.getStart(), "an element before IS");
    }

    private static ComparisonOperator comparisonOperator(VeroParser.ComparisonOperatorContext context) {
        return switch (context.getStart().getType()) {
            case VeroParser.NEQ -> ComparisonOperator.NOT_EQUAL;
            case VeroParser.GT -> ComparisonOperator.GREATER;
            case VeroParser.LT -> ComparisonOperator.LESS;
            case VeroParser.GTE -> ComparisonOperator.GREATER_OR_EQUAL;
            case VeroParser.LTE -> ComparisonOperator.LESS_OR_EQUAL;
            default -> ComparisonOperator.EQUAL;
        };
    }

    ElementState elementState(VeroParser.ElementStateContext context) {
        Token token = context.getStart();
        return token.getType() == VeroParser.HIDDEN_STATE
            ? ElementState.HIDDEN
            : ElementState.valueOf(symbolicName(token));
    }

    // Names, types and numbers

    static String name(VeroParser.NameContext context) {
        return context.getText();
    }

    static VarType varType(VeroParser.VarTypeContext context) {
        return VarType.valueOf(symbolicName(context.getStart()));
    }

    static String symbolicName(Token token) {
        return VeroParser.VOCABULARY.getSymbolicName(token.getType());
    }

    /**
     * Reads a non-negative integer such as a limit or position.
     *
     * @throws RejectedConstruct if the number has a fraction, a sign or too many digits
     */
    int wholeNumber(Token token, String context) {
        if (!WHOLE_NUMBER.matcher(token.getText()).matches()) {
            throw reject(token, "a whole number " + context);
        }
        return Integer.parseInt(token.getText());
    }

    /**
     * Records an error at {@code token} and returns the exception that drops the construct.
     */
    RejectedConstruct reject(Token token, String expected) {
        errors.add(ParserErrors.unexpectedToken(expected, SyntaxErrorListener.describe(token),
            token.getLine(), token.getCharPositionInLine() + 1));
        return new RejectedConstruct(expected);
    }

    RejectedConstruct reject(ParserRuleContext context, String expected) {
        return reject(context.getStart(), expected);
    }

    /**
     * A construct that parsed but cannot be represented. Its error is already recorded.
     */
    static final class RejectedConstruct extends RuntimeException {

        RejectedConstruct(String expected) {
            super("Expected " + expected);
        }
    }
}

package com.verolang.core.parser;

import com.verolang.core.ast.ActionCall;
import com.verolang.core.ast.Expression;
import com.verolang.core.ast.Target;
import com.verolang.core.ast.VarType;
import com.verolang.core.ast.VariableReference;
import com.verolang.core.ast.query.DataQuery;
import com.verolang.core.ast.query.ResultType;
import com.verolang.core.ast.statement.CheckStatement;
import com.verolang.core.ast.statement.ClearStatement;
import com.verolang.core.ast.statement.ClickStatement;
import com.verolang.core.ast.statement.ClickStatement.ClickType;
import com.verolang.core.ast.statement.CookieStatement;
import com.verolang.core.ast.statement.DataQueryStatement;
import com.verolang.core.ast.statement.DialogStatement;
import com.verolang.core.ast.statement.DragStatement;
import com.verolang.core.ast.statement.FillStatement;
import com.verolang.core.ast.statement.ForEachStatement;
import com.verolang.core.ast.statement.FrameStatement;
import com.verolang.core.ast.statement.HoverStatement;
import com.verolang.core.ast.statement.IfStatement;
import com.verolang.core.ast.statement.LogStatement;
import com.verolang.core.ast.statement.OpenStatement;
import com.verolang.core.ast.statement.PerformStatement;
import com.verolang.core.ast.statement.PressStatement;
import com.verolang.core.ast.statement.RefreshStatement;
import com.verolang.core.ast.statement.RepeatStatement;
import com.verolang.core.ast.statement.ReturnStatement;
import com.verolang.core.ast.statement.ScreenshotStatement;
import com.verolang.core.ast.statement.ScrollStatement;
import com.verolang.core.ast.statement.SelectStatement;
import com.verolang.core.ast.statement.Statement;
import com.verolang.core.ast.statement.StorageStatement;
import com.verolang.core.ast.statement.TabStatement;
import com.verolang.core.ast.statement.TextMatch;
import com.verolang.core.ast.statement.UploadStatement;
import com.verolang.core.ast.statement.VariableDeclaration;
import com.verolang.core.ast.statement.VerifyElementStatement;
import com.verolang.core.ast.statement.VerifyElementStatement.Check;
import com.verolang.core.ast.statement.VerifyPageStatement;
import com.verolang.core.ast.statement.VerifyVariableStatement;
import com.verolang.core.ast.statement.WaitForElementStatement;
import com.verolang.core.ast.statement.WaitForLoadStatement;
import com.verolang.core.ast.statement.WaitForUrlStatement;
import com.verolang.core.ast.statement.WaitStatement;
import com.verolang.core.grammar.VeroBaseVisitor;
import com.verolang.core.grammar.VeroParser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Builds one {@link Statement} per statement parse tree. Nested blocks are built through the
 * {@code blocks} function so that broken statements inside them are dropped the same way as at
 * the top of a scenario.
 */
final class StatementBuilder extends VeroBaseVisitor<Statement> {

    private static final Pattern COORDINATE = Pattern.compile("-?\\d{1,9}");

    private final ExpressionBuilder expressions;
    private final DataQueryBuilder queries;
    private final Function<VeroParser.BlockContext, List<Statement>> blocks;

    StatementBuilder(ExpressionBuilder expressions, DataQueryBuilder queries,
                     Function<VeroParser.BlockContext, List<Statement>> blocks) {
        this.expressions = expressions;
        this.queries = queries;
        this.blocks = blocks;
    }

    // Actions

    @Override
    public Statement visitClickStatement(VeroParser.ClickStatementContext context) {
        ClickType type = ClickType.SINGLE;
        if (context.modifier != null) {
            type = switch (context.modifier.getType()) {
                case VeroParser.DOUBLE -> ClickType.DOUBLE;
                case VeroParser.RIGHT -> ClickType.RIGHT;
                default -> ClickType.FORCE;
            };
        }
        return new ClickStatement(target(context.target()), type, line(context));
    }

    @Override
    public Statement visitFillStatement(VeroParser.FillStatementContext context) {
        return new FillStatement(target(context.target()), expression(context.expression()), line(context));
    }

    @Override
    public Statement visitOpenStatement(VeroParser.OpenStatementContext context) {
        return new OpenStatement(expression(context.expression()), context.TAB() != null, line(context));
    }

    @Override
    public Statement visitCheckStatement(VeroParser.CheckStatementContext context) {
        return new CheckStatement(target(context.target()), context.CHECK() != null, line(context));
    }

    @Override
    public Statement visitSelectStatement(VeroParser.SelectStatementContext context) {
        return new SelectStatement(expression(context.expression()), target(context.target()), line(context));
    }

    @Override
    public Statement visitHoverStatement(VeroParser.HoverStatementContext context) {
        return new HoverStatement(target(context.target()), line(context));
    }

    @Override
    public Statement visitPressStatement(VeroParser.PressStatementContext context) {
        return new PressStatement(expression(context.expression()), line(context));
    }

    @Override
    public Statement visitScrollStatement(VeroParser.ScrollStatementContext context) {
        if (context.direction == null) {
            return new ScrollStatement(null, target(context.target()), line(context));
        }
        ScrollStatement.Direction direction = switch (context.direction.getType()) {
            case VeroParser.UP -> ScrollStatement.Direction.UP;
            case VeroParser.DOWN -> ScrollStatement.Direction.DOWN;
            case VeroParser.LEFT -> ScrollStatement.Direction.LEFT;
            default -> ScrollStatement.Direction.RIGHT;
        };
        return new ScrollStatement(direction, null, line(context));
    }

    @Override
    public Statement visitDragStatement(VeroParser.DragStatementContext context) {
        Target source = target(context.target(0));
        if (context.x != null) {
            return new DragStatement(source, null, coordinate(context.x), coordinate(context.y), line(context));
        }
        return new DragStatement(source, target(context.target(1)), null, null, line(context));
    }

    private int coordinate(Token token) {
        if (!COORDINATE.matcher(token.getText()).matches()) {
            throw expressions.reject(token, "a whole number coordinate");
        }
        return Integer.parseInt(token.getText());
    }

    @Override
    public Statement visitUploadStatement(VeroParser.UploadStatementContext context) {
        List<Expression> files = new ArrayList<>();
        for (VeroParser.ExpressionContext file : context.expression()) {
            files.add(expression(file));
        }
        return new UploadStatement(files, target(context.target()), line(context));
    }

    @Override
    public Statement visitWaitStatement(VeroParser.WaitStatementContext context) {
        int line = line(context);
        if (context.waitCondition() != null) {
            return waitFor(context.waitCondition(), line);
        }
        if (context.amount != null) {
            WaitStatement.Unit unit = context.MILLISECONDS() != null
                ? WaitStatement.Unit.MILLISECONDS
                : WaitStatement.Unit.SECONDS;
            return new WaitStatement(Double.parseDouble(context.amount.getText()), unit, line);
        }
        return new WaitForLoadStatement(WaitForLoadStatement.LoadState.NETWORK_IDLE, line);
    }

    private Statement waitFor(VeroParser.WaitConditionContext context, int line) {
        if (context instanceof VeroParser.NavigationWaitContext) {
            return new WaitForLoadStatement(WaitForLoadStatement.LoadState.NAVIGATION, line);
        }
        if (context instanceof VeroParser.NetworkIdleWaitContext) {
            return new WaitForLoadStatement(WaitForLoadStatement.LoadState.NETWORK_IDLE, line);
        }
        if (context instanceof VeroParser.UrlWaitContext url) {
            return new WaitForUrlStatement(textMatch(url.textMatch()), expression(url.expression()), line);
        }
        return new WaitForElementStatement(target(((VeroParser.ElementWaitContext) context).target()), line);
    }

    @Override
    public Statement visitRefreshStatement(VeroParser.RefreshStatementContext context) {
        return new RefreshStatement(line(context));
    }

    @Override
    public Statement visitClearStatement(VeroParser.ClearStatementContext context) {
        if (context.COOKIES() != null) {
            return new CookieStatement(CookieStatement.Action.CLEAR, null, null, line(context));
        }
        if (context.STORAGE() != null) {
            return new StorageStatement(StorageStatement.Action.CLEAR, null, null, null, line(context));
        }
        return new ClearStatement(target(context.target()), line(context));
    }

    @Override
    public Statement visitScreenshotStatement(VeroParser.ScreenshotStatementContext context) {
        Target target = context.target() == null ? null : target(context.target());
        String filename = context.STRING() == null ? null : context.STRING().getText();
        return new ScreenshotStatement(target, filename, line(context));
    }

    @Override
    public Statement visitLogStatement(VeroParser.LogStatementContext context) {
        return new LogStatement(expression(context.expression()), line(context));
    }

    @Override
    public Statement visitSwitchStatement(VeroParser.SwitchStatementContext context) {
        int line = line(context);
        if (context.NEW() != null) {
            Expression url = context.expression() == null ? null : expression(context.expression());
            return new TabStatement(TabStatement.Action.SWITCH_TO_NEW, url, line);
        }
        if (context.TAB() != null) {
            return new TabStatement(TabStatement.Action.SWITCH_TO, expression(context.expression()), line);
        }
        if (context.MAIN() != null) {
            return new FrameStatement(null, line);
        }
        return new FrameStatement(expressions.selector(context.selectorExpression()), line);
    }

    @Override
    public Statement visitCloseTabStatement(VeroParser.CloseTabStatementContext context) {
        return new TabStatement(TabStatement.Action.CLOSE, null, line(context));
    }

    @Override
    public Statement visitDialogStatement(VeroParser.DialogStatementContext context) {
        if (context.DISMISS() != null) {
            return new DialogStatement(false, null, line(context));
        }
        Expression response = context.expression() == null ? null : expression(context.expression());
        return new DialogStatement(true, response, line(context));
    }

    @Override
    public Statement visitSetStatement(VeroParser.SetStatementContext context) {
        Expression key = expression(context.expression(0));
        Expression value = expression(context.expression(1));
        if (context.COOKIE() != null) {
            return new CookieStatement(CookieStatement.Action.SET, key, value, line(context));
        }
        return new StorageStatement(StorageStatement.Action.SET, key, value, null, line(context));
    }

    @Override
    public Statement visitGetStorageStatement(VeroParser.GetStorageStatementContext context) {
        return new StorageStatement(StorageStatement.Action.GET, expression(context.expression()), null,
            ExpressionBuilder.name(context.name()), line(context));
    }

    @Override
    public Statement visitPerformStatement(VeroParser.PerformStatementContext context) {
        return new PerformStatement(actionCall(context.actionCall()), null, null, line(context));
    }

    private ActionCall actionCall(VeroParser.ActionCallContext context) {
        List<VeroParser.NameContext> names = context.name();
        String page = names.size() == 2 ? ExpressionBuilder.name(names.get(0)) : null;
        String action = ExpressionBuilder.name(names.get(names.size() - 1));
        List<Expression> arguments = new ArrayList<>();
        for (VeroParser.ExpressionContext argument : context.expression()) {
            arguments.add(expression(argument));
        }
        return new ActionCall(page, action, arguments);
    }

    @Override
    public Statement visitReturnStatement(VeroParser.ReturnStatementContext context) {
        int line = line(context);
        VeroParser.ReturnValueContext value = context.returnValue();
        if (value == null) {
            return new ReturnStatement(ReturnStatement.Kind.NOTHING, null, null, line);
        }
        if (value instanceof VeroParser.ElementReturnContext element) {
            ReturnStatement.Kind kind = switch (element.kind.getType()) {
                case VeroParser.VISIBLE -> ReturnStatement.Kind.VISIBLE_OF;
                case VeroParser.TEXT -> ReturnStatement.Kind.TEXT_OF;
                default -> ReturnStatement.Kind.VALUE_OF;
            };
            return new ReturnStatement(kind, target(element.target()), null, line);
        }
        VeroParser.ExpressionReturnContext expression = (VeroParser.ExpressionReturnContext) value;
        return new ReturnStatement(ReturnStatement.Kind.EXPRESSION, null, expression(expression.expression()), line);
    }

    // Assertions

    @Override
    public Statement visitVerifyStatement(VeroParser.VerifyStatementContext context) {
        int line = line(context);
        if (context.textMatch() != null) {
            VerifyPageStatement.Subject subject = context.URL() != null
                ? VerifyPageStatement.Subject.URL
                : VerifyPageStatement.Subject.TITLE;
            return new VerifyPageStatement(subject, textMatch(context.textMatch()), expression(context.expression()),
                line);
        }

        Target target = target(context.target());
        VeroParser.VerificationContext verification = context.verification();
        if (verification instanceof VeroParser.IsVerificationContext is) {
            boolean negated = is.NOT() != null;
            if (is.TRUE() != null || is.FALSE() != null) {
                VerifyVariableStatement.Kind kind = is.TRUE() != null
                    ? VerifyVariableStatement.Kind.IS_TRUE
                    : VerifyVariableStatement.Kind.IS_FALSE;
                return new VerifyVariableStatement(variableOf(context.target(), target), negated, kind, null, line);
            }
            if (is.CONTAINS() != null) {
                return new VerifyElementStatement(target, negated,
                    Check.of(VerifyElementStatement.Kind.CONTAINS, expression(is.expression())), line);
            }
            return new VerifyElementStatement(target, negated,
                Check.state(expressions.elementState(is.elementState())), line);
        }
        if (verification instanceof VeroParser.ValueVerificationContext value) {
            boolean negated = value.NOT() != null;
            if (value.CONTAINS() != null) {
                return new VerifyElementStatement(target, negated,
                    Check.of(VerifyElementStatement.Kind.CONTAINS, expression(value.expression())), line);
            }
            return new VerifyVariableStatement(variableOf(context.target(), target), negated,
                VerifyVariableStatement.Kind.EQUALS, expression(value.expression()), line);
        }
        VeroParser.HasVerificationContext has = (VeroParser.HasVerificationContext) verification;
        return new VerifyElementStatement(target, false, hasCheck(has.hasCheck()), line);
    }

    private Check hasCheck(VeroParser.HasCheckContext context) {
        if (context instanceof VeroParser.AttributeHasCheckContext attribute) {
            return Check.attribute(expression(attribute.expression(0)), expression(attribute.expression(1)));
        }
        VeroParser.ValueHasCheckContext value = (VeroParser.ValueHasCheckContext) context;
        VerifyElementStatement.Kind kind = switch (value.kind.getType()) {
            case VeroParser.TEXT -> VerifyElementStatement.Kind.HAS_TEXT;
            case VeroParser.VALUE -> VerifyElementStatement.Kind.HAS_VALUE;
            case VeroParser.COUNT -> VerifyElementStatement.Kind.HAS_COUNT;
            default -> VerifyElementStatement.Kind.HAS_CLASS;
        };
        return Check.of(kind, expression(value.expression()));
    }

    private VariableReference variableOf(VeroParser.TargetContext context, Target target) {
        if (target.hasSelector()) {
            throw expressions.reject(context, "a variable name instead of a selector");
        }
        return new VariableReference(target.page(), target.field());
    }

    private static TextMatch textMatch(VeroParser.TextMatchContext context) {
        return switch (context.getStart().getType()) {
            case VeroParser.CONTAINS -> TextMatch.CONTAINS;
            case VeroParser.EQUALS -> TextMatch.EQUALS;
            default -> TextMatch.MATCHES;
        };
    }

    // Control flow

    @Override
    public Statement visitConditionalStatement(VeroParser.ConditionalStatementContext context) {
        return ifStatement(context.ifStatement());
    }

    private IfStatement ifStatement(VeroParser.IfStatementContext context) {
        List<Statement> thenStatements = blocks.apply(context.block(0));
        List<Statement> elseStatements = List.of();
        if (context.ifStatement() != null) {
            elseStatements = List.of(ifStatement(context.ifStatement()));
        } else if (context.block().size() > 1) {
            elseStatements = blocks.apply(context.block(1));
        }
        return new IfStatement(expressions.condition(context.condition()), thenStatements, elseStatements,
            line(context));
    }

    @Override
    public Statement visitRepeatStatement(VeroParser.RepeatStatementContext context) {
        return new RepeatStatement(expression(context.expression()), blocks.apply(context.block()), line(context));
    }

    @Override
    public Statement visitForEachStatement(VeroParser.ForEachStatementContext context) {
        return new ForEachStatement(ExpressionBuilder.name(context.name(0)), ExpressionBuilder.name(context.name(1)),
            blocks.apply(context.block()), line(context));
    }

    // Variables and data

    @Override
    public Statement visitVariableStatement(VeroParser.VariableStatementContext context) {
        VarType type = ExpressionBuilder.varType(context.varType());
        String name = ExpressionBuilder.name(context.name());
        int line = line(context);
        VeroParser.AssignedValueContext value = context.assignedValue();

        if (value instanceof VeroParser.PerformValueContext perform) {
            return new PerformStatement(actionCall(perform.actionCall()), type, name, line);
        }
        if (value instanceof VeroParser.QueryValueContext query) {
            DataQuery dataQuery = queries.valueQuery(query.dataQuery());
            ResultType resultType;
            if (dataQuery.aggregation() != null) {
                resultType = dataQuery.aggregation().resultType();
            } else {
                resultType = type == VarType.NUMBER ? ResultType.NUMBER : ResultType.TEXT;
            }
            return new DataQueryStatement(resultType, name, dataQuery, line);
        }
        VeroParser.ExpressionValueContext expression = (VeroParser.ExpressionValueContext) value;
        return new VariableDeclaration(type, name, expression(expression.expression()), line);
    }

    @Override
    public Statement visitRowStatement(VeroParser.RowStatementContext context) {
        return queries.row(context);
    }

    @Override
    public Statement visitRowsStatement(VeroParser.RowsStatementContext context) {
        return queries.rows(context);
    }

    @Override
    public Statement visitLoadStatement(VeroParser.LoadStatementContext context) {
        return queries.load(context);
    }

    private Target target(VeroParser.TargetContext context) {
        return expressions.target(context);
    }

    private Expression expression(VeroParser.ExpressionContext context) {
        return expressions.expression(context);
    }

    private static int line(ParserRuleContext context) {
        return context.getStart().getLine();
    }
}

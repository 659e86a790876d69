package com.verolang.core.parser;

import com.verolang.core.ast.Expression;
import com.verolang.core.ast.query.Aggregation;
import com.verolang.core.ast.query.DataCondition;
import com.verolang.core.ast.query.DataOperator;
import com.verolang.core.ast.query.DataQuery;
import com.verolang.core.ast.query.OrderBy;
import com.verolang.core.ast.query.ResultType;
import com.verolang.core.ast.query.RowPosition;
import com.verolang.core.ast.query.TableRef;
import com.verolang.core.ast.statement.DataQueryStatement;
import com.verolang.core.ast.statement.LoadStatement;
import com.verolang.core.grammar.VeroBaseVisitor;
import com.verolang.core.grammar.VeroParser;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds test data statements: {@code LOAD}, {@code ROW}, {@code ROWS}, the queries on the right
 * of a variable declaration and their {@code WHERE} clauses.
 */
final class DataQueryBuilder extends VeroBaseVisitor<DataCondition> {

    private final ExpressionBuilder expressions;

    DataQueryBuilder(ExpressionBuilder expressions) {
        this.expressions = expressions;
    }

    /**
     * {@code ROW name = [FIRST|LAST|RANDOM] table ...}.
     */
    DataQueryStatement row(VeroParser.RowStatementContext context) {
        RowPosition position = context.rowPosition() == null ? null : rowPosition(context.rowPosition().getStart());
        DataQuery query = new DataQuery(tableRef(context.tableRef()), position, null, where(context.whereClause()),
            orderBy(context.orderByClause()), null, null, null);
        return new DataQueryStatement(ResultType.DATA, ExpressionBuilder.name(context.name()), query,
            context.getStart().getLine());
    }

    /**
     * {@code ROWS name = table ... [LIMIT n] [OFFSET n]}.
     */
    DataQueryStatement rows(VeroParser.RowsStatementContext context) {
        Integer limit = context.limitClause() == null
            ? null
            : expressions.wholeNumber(context.limitClause().NUMBER_LITERAL().getSymbol(), "after LIMIT");
        Integer offset = context.offsetClause() == null
            ? null
            : expressions.wholeNumber(context.offsetClause().NUMBER_LITERAL().getSymbol(), "after OFFSET");
        DataQuery query = new DataQuery(tableRef(context.tableRef()), null, null, where(context.whereClause()),
            orderBy(context.orderByClause()), limit, offset, null);
        return new DataQueryStatement(ResultType.LIST, ExpressionBuilder.name(context.name()), query,
            context.getStart().getLine());
    }

    /**
     * {@code LOAD name FROM table [WHERE ...]}; a quoted table name is taken as written.
     */
    LoadStatement load(VeroParser.LoadStatementContext context) {
        TableRef table = context.STRING() != null
            ? TableRef.of(context.STRING().getText())
            : tableRef(context.tableRef());
        return new LoadStatement(ExpressionBuilder.name(context.name()), table, where(context.whereClause()),
            context.getStart().getLine());
    }

    /**
     * Query on the right of {@code TEXT|NUMBER|LIST name =}.
     */
    DataQuery valueQuery(VeroParser.DataQueryContext context) {
        if (context instanceof VeroParser.CountQueryContext count) {
            return new DataQuery(tableRef(count.tableRef()), null, null, where(count.whereClause()), List.of(),
                null, null, Aggregation.COUNT);
        }
        if (context instanceof VeroParser.AggregateQueryContext aggregate) {
            VeroParser.ColumnRefContext column = aggregate.columnRef();
            Aggregation aggregation = Aggregation.valueOf(ExpressionBuilder.symbolicName(aggregate.aggregate));
            return new DataQuery(tableOf(column), null, columnOf(column), where(aggregate.whereClause()), List.of(),
                null, null, aggregation);
        }
        VeroParser.PositionQueryContext positional = (VeroParser.PositionQueryContext) context;
        VeroParser.ColumnRefContext column = positional.columnRef();
        return new DataQuery(tableOf(column), rowPosition(positional.position), columnOf(column),
            where(positional.whereClause()), orderBy(positional.orderByClause()), null, null, null);
    }

    private static TableRef tableRef(VeroParser.TableRefContext context) {
        List<VeroParser.NameContext> names = context.name();
        if (names.size() == 2) {
            return new TableRef(ExpressionBuilder.name(names.get(0)), ExpressionBuilder.name(names.get(1)));
        }
        return TableRef.of(ExpressionBuilder.name(names.get(0)));
    }

    /** {@code table.column} or {@code project.table.column}. */
    private static TableRef tableOf(VeroParser.ColumnRefContext context) {
        List<VeroParser.NameContext> names = context.name();
        if (names.size() == 3) {
            return new TableRef(ExpressionBuilder.name(names.get(0)), ExpressionBuilder.name(names.get(1)));
        }
        return TableRef.of(ExpressionBuilder.name(names.get(0)));
    }

    private static String columnOf(VeroParser.ColumnRefContext context) {
        List<VeroParser.NameContext> names = context.name();
        return ExpressionBuilder.name(names.get(names.size() - 1));
    }

    private static RowPosition rowPosition(Token token) {
        return switch (token.getType()) {
            case VeroParser.LAST -> RowPosition.LAST;
            case VeroParser.RANDOM -> RowPosition.RANDOM;
            default -> RowPosition.FIRST;
        };
    }

    private List<OrderBy> orderBy(VeroParser.OrderByClauseContext context) {
        if (context == null) {
            return List.of();
        }
        List<OrderBy> keys = new ArrayList<>();
        for (VeroParser.OrderKeyContext key : context.orderKey()) {
            keys.add(new OrderBy(ExpressionBuilder.name(key.name()), key.DESC() != null));
        }
        return keys;
    }

    // WHERE clauses

    private DataCondition where(VeroParser.WhereClauseContext context) {
        return context == null ? null : visit(context.dataCondition());
    }

    /**
     * {@code AND} and {@code OR} bind equally and associate to the left.
     */
    @Override
    public DataCondition visitDataCondition(VeroParser.DataConditionContext context) {
        DataCondition condition = null;
        int connective = 0;
        for (ParseTree child : context.children) {
            if (child instanceof TerminalNode terminal) {
                connective = terminal.getSymbol().getType();
            } else if (child instanceof VeroParser.DataUnaryContext unary) {
                DataCondition operand = visit(unary);
                if (condition == null) {
                    condition = operand;
                } else if (connective == VeroParser.OR) {
                    condition = new DataCondition.Or(condition, operand);
                } else {
                    condition = new DataCondition.And(condition, operand);
                }
            }
        }
        return condition;
    }

    @Override
    public DataCondition visitNotCondition(VeroParser.NotConditionContext context) {
        return new DataCondition.Not(visit(context.dataUnary()));
    }

    @Override
    public DataCondition visitGroupedCondition(VeroParser.GroupedConditionContext context) {
        return visit(context.dataCondition());
    }

    @Override
    public DataCondition visitColumnCondition(VeroParser.ColumnConditionContext context) {
        String column = ExpressionBuilder.name(context.name());
        VeroParser.DataComparisonContext comparison = context.dataComparison();

        if (comparison instanceof VeroParser.ValueComparisonContext value) {
            return new DataCondition.Compare(column, valueOperator(value.op),
                expressions.expression(value.expression()), null);
        }
        if (comparison instanceof VeroParser.AffixComparisonContext affix) {
            DataOperator operator = affix.affix.getType() == VeroParser.STARTS
                ? DataOperator.STARTS_WITH
                : DataOperator.ENDS_WITH;
            return new DataCondition.Compare(column, operator, expressions.expression(affix.expression()), null);
        }
        if (comparison instanceof VeroParser.ListComparisonContext list) {
            List<Expression> values = new ArrayList<>();
            for (VeroParser.ExpressionContext expression : list.expression()) {
                values.add(expressions.expression(expression));
            }
            DataOperator operator = list.NOT() != null ? DataOperator.NOT_IN : DataOperator.IN;
            return new DataCondition.Compare(column, operator, null, values);
        }

        VeroParser.EmptyComparisonContext empty = (VeroParser.EmptyComparisonContext) comparison;
        boolean negated = empty.NOT() != null;
        DataOperator operator;
        if (empty.EMPTY() != null) {
            operator = negated ? DataOperator.IS_NOT_EMPTY : DataOperator.IS_EMPTY;
        } else {
            operator = negated ? DataOperator.IS_NOT_NULL : DataOperator.IS_NULL;
        }
        return new DataCondition.Compare(column, operator, null, null);
    }

    private static DataOperator valueOperator(Token token) {
        return switch (token.getType()) {
            case VeroParser.NEQ -> DataOperator.NOT_EQUAL;
            case VeroParser.GT -> DataOperator.GREATER;
            case VeroParser.LT -> DataOperator.LESS;
            case VeroParser.GTE -> DataOperator.GREATER_OR_EQUAL;
            case VeroParser.LTE -> DataOperator.LESS_OR_EQUAL;
            case VeroParser.CONTAINS -> DataOperator.CONTAINS;
            case VeroParser.MATCHES -> DataOperator.MATCHES;
            default -> DataOperator.EQUAL;
        };
    }
}

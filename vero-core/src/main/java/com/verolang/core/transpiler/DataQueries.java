package com.verolang.core.transpiler;

import com.verolang.core.ast.Expression;
import com.verolang.core.ast.query.DataCondition;
import com.verolang.core.ast.query.DataQuery;
import com.verolang.core.ast.query.OrderBy;
import com.verolang.core.ast.query.ResultType;
import com.verolang.core.ast.query.RowPosition;
import com.verolang.core.ast.query.TableRef;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Lowers test data queries to array pipelines over {@code __table__(...)}.
 *
 * <p>WHERE trees are emitted fully parenthesized in the shape the parser built them, so
 * {@code a OR b AND c} evaluates as {@code (a || b) && c}.
 */
final class DataQueries {

    private static final String ROW = "__row__";

    private final Function<Expression, String> values;

    /**
     * @param values renders right-hand values of comparisons
     */
    DataQueries(Function<Expression, String> values) {
        this.values = values;
    }

    /**
     * Value of a {@code ROW}, {@code ROWS} or value query.
     */
    String query(DataQuery query, ResultType resultType) {
        String rows = rows(query.table(), query.where(), query.orderBy(), query.limit(), query.offset());
        if (query.aggregation() != null) {
            return aggregate(query, rows);
        }
        if (resultType == ResultType.LIST) {
            return query.column() == null ? rows : rows + ".map((" + ROW + ") => " + column(query.column()) + ")";
        }

        String picked = pick(query.position() == null ? RowPosition.FIRST : query.position(), rows);
        if (query.column() == null) {
            return picked;
        }
        String value = picked + "?.[" + TypeScript.quote(query.column()) + "]";
        return resultType == ResultType.NUMBER ? "Number(" + value + ")" : value;
    }

    /**
     * {@code LOAD name FROM table WHERE ...}.
     */
    String load(TableRef table, DataCondition where) {
        return rows(table, where, List.of(), null, null);
    }

    String rows(TableRef table, DataCondition where, List<OrderBy> orderBy, Integer limit, Integer offset) {
        StringBuilder code = new StringBuilder("__table__(").append(TypeScript.quote(table.qualifiedName())).append(')');
        if (where != null) {
            code.append(".filter((").append(ROW).append(") => ").append(condition(where)).append(')');
        }
        if (!orderBy.isEmpty()) {
            code.append(".sort((a, b) => ").append(comparator(orderBy)).append(')');
        }
        if (limit != null || offset != null) {
            int start = offset == null ? 0 : offset;
            code.append(".slice(").append(start);
            if (limit != null) {
                code.append(", ").append(start + limit);
            }
            code.append(')');
        }
        return code.toString();
    }

    String condition(DataCondition condition) {
        if (condition instanceof DataCondition.And and) {
            return "(" + condition(and.left()) + " && " + condition(and.right()) + ")";
        }
        if (condition instanceof DataCondition.Or or) {
            return "(" + condition(or.left()) + " || " + condition(or.right()) + ")";
        }
        if (condition instanceof DataCondition.Not not) {
            return "!" + condition(not.condition());
        }
        return compare((DataCondition.Compare) condition);
    }

    private String compare(DataCondition.Compare compare) {
        String column = column(compare.column());
        String asText = "String(" + column + " ?? '')";
        return switch (compare.operator()) {
            case EQUAL -> "(" + column + " == " + value(compare) + ")";
            case NOT_EQUAL -> "(" + column + " != " + value(compare) + ")";
            case GREATER -> "(" + column + " > " + value(compare) + ")";
            case LESS -> "(" + column + " < " + value(compare) + ")";
            case GREATER_OR_EQUAL -> "(" + column + " >= " + value(compare) + ")";
            case LESS_OR_EQUAL -> "(" + column + " <= " + value(compare) + ")";
            case CONTAINS -> asText + ".includes(String(" + value(compare) + "))";
            case STARTS_WITH -> asText + ".startsWith(String(" + value(compare) + "))";
            case ENDS_WITH -> asText + ".endsWith(String(" + value(compare) + "))";
            case MATCHES -> "new RegExp(String(" + value(compare) + ")).test(" + asText + ")";
            case IN -> inList(compare, column);
            case NOT_IN -> "!" + inList(compare, column);
            case IS_EMPTY -> "(" + column + " === undefined || " + column + " === null || " + asText + ".trim() === '')";
            case IS_NOT_EMPTY -> "!(" + column + " === undefined || " + column + " === null || " + asText + ".trim() === '')";
            case IS_NULL -> "(" + column + " === undefined || " + column + " === null)";
            case IS_NOT_NULL -> "(" + column + " !== undefined && " + column + " !== null)";
        };
    }

    private String inList(DataCondition.Compare compare, String column) {
        String list = compare.values().stream().map(values).collect(Collectors.joining(", "));
        return "[" + list + "].some((candidate) => candidate == " + column + ")";
    }

    private String value(DataCondition.Compare compare) {
        return values.apply(compare.value());
    }

    private static String comparator(List<OrderBy> orderBy) {
        return orderBy.stream()
            .map(key -> key.descending()
                ? "__compare__(b[" + TypeScript.quote(key.column()) + "], a[" + TypeScript.quote(key.column()) + "])"
                : "__compare__(a[" + TypeScript.quote(key.column()) + "], b[" + TypeScript.quote(key.column()) + "])")
            .collect(Collectors.joining(" || "));
    }

    private static String aggregate(DataQuery query, String rows) {
        String column = query.column() == null ? null : column(query.column());
        return switch (query.aggregation()) {
            case COUNT -> rows + ".length";
            case SUM -> rows + ".reduce((sum, " + ROW + ") => sum + Number(" + column + "), 0)";
            case AVERAGE -> "__average__(" + rows + ".map((" + ROW + ") => " + column + "))";
            case MIN -> "Math.min(..." + rows + ".map((" + ROW + ") => Number(" + column + ")))";
            case MAX -> "Math.max(..." + rows + ".map((" + ROW + ") => Number(" + column + ")))";
            case DISTINCT -> "[...new Set(" + rows + ".map((" + ROW + ") => " + column + "))]";
        };
    }

    private static String pick(RowPosition position, String rows) {
        return switch (position) {
            case FIRST -> "__first__(" + rows + ")";
            case LAST -> "__last__(" + rows + ")";
            case RANDOM -> "__random__(" + rows + ")";
        };
    }

    private static String column(String name) {
        return TypeScript.property(ROW, name);
    }
}

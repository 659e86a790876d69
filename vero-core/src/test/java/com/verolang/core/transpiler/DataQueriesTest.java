package com.verolang.core.transpiler;

import com.verolang.core.ast.Expression;
import com.verolang.core.ast.NumberLiteral;
import com.verolang.core.ast.StringLiteral;
import com.verolang.core.ast.query.Aggregation;
import com.verolang.core.ast.query.DataCondition;
import com.verolang.core.ast.query.DataOperator;
import com.verolang.core.ast.query.DataQuery;
import com.verolang.core.ast.query.OrderBy;
import com.verolang.core.ast.query.ResultType;
import com.verolang.core.ast.query.RowPosition;
import com.verolang.core.ast.query.TableRef;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DataQueries}.
 */
class DataQueriesTest {

    private static final TableRef USERS = TableRef.of("Users");

    private final DataQueries queries = new DataQueries(DataQueriesTest::literal);

    @Test
    void query_rowsWithFilterSortAndPaging_chainsArrayOperations() {
        DataQuery query = new DataQuery(USERS, null, null, equal("role", "admin"),
            List.of(new OrderBy("name", true)), 5, 10, null);

        assertThat(queries.query(query, ResultType.LIST)).isEqualTo(
            "__table__('Users')"
                + ".filter((__row__) => (__row__['role'] == 'admin'))"
                + ".sort((a, b) => __compare__(b['name'], a['name']))"
                + ".slice(10, 15)");
    }

    @Test
    void rows_limitOrOffsetAlone_slicesFromStartOrToEnd() {
        assertThat(queries.rows(USERS, null, List.of(), 5, null)).isEqualTo("__table__('Users').slice(0, 5)");
        assertThat(queries.rows(USERS, null, List.of(), null, 3)).isEqualTo("__table__('Users').slice(3)");
    }

    @Test
    void rows_severalSortKeys_fallBackInOrder() {
        String rows = queries.rows(USERS, null, List.of(new OrderBy("last", false), new OrderBy("first", true)),
            null, null);

        assertThat(rows).isEqualTo("__table__('Users').sort((a, b) => "
            + "__compare__(a['last'], b['last']) || __compare__(b['first'], a['first']))");
    }

    @Test
    void query_singleRow_picksByPosition() {
        DataQuery random = new DataQuery(USERS, RowPosition.RANDOM, null, null, List.of(), null, null, null);
        DataQuery unspecified = new DataQuery(USERS, null, null, null, List.of(), null, null, null);

        assertThat(queries.query(random, ResultType.DATA)).isEqualTo("__random__(__table__('Users'))");
        assertThat(queries.query(unspecified, ResultType.DATA)).isEqualTo("__first__(__table__('Users'))");
    }

    @Test
    void query_columnValue_readsOptionalPropertyAndCoercesNumbers() {
        DataQuery email = new DataQuery(USERS, RowPosition.FIRST, "email", null, List.of(), null, null, null);
        DataQuery age = new DataQuery(USERS, RowPosition.LAST, "age", null, List.of(), null, null, null);

        assertThat(queries.query(email, ResultType.TEXT)).isEqualTo("__first__(__table__('Users'))?.['email']");
        assertThat(queries.query(age, ResultType.NUMBER)).isEqualTo("Number(__last__(__table__('Users'))?.['age'])");
    }

    @Test
    void query_aggregations_reduceRows() {
        TableRef orders = new TableRef("Shop", "Orders");

        assertThat(queries.query(aggregate(orders, null, Aggregation.COUNT), ResultType.NUMBER))
            .isEqualTo("__table__('Shop.Orders').length");
        assertThat(queries.query(aggregate(orders, "amount", Aggregation.SUM), ResultType.NUMBER))
            .isEqualTo("__table__('Shop.Orders').reduce((sum, __row__) => sum + Number(__row__['amount']), 0)");
        assertThat(queries.query(aggregate(orders, "amount", Aggregation.AVERAGE), ResultType.NUMBER))
            .isEqualTo("__average__(__table__('Shop.Orders').map((__row__) => __row__['amount']))");
        assertThat(queries.query(aggregate(orders, "amount", Aggregation.MAX), ResultType.NUMBER))
            .isEqualTo("Math.max(...__table__('Shop.Orders').map((__row__) => Number(__row__['amount'])))");
        assertThat(queries.query(aggregate(orders, "status", Aggregation.DISTINCT), ResultType.LIST))
            .isEqualTo("[...new Set(__table__('Shop.Orders').map((__row__) => __row__['status']))]");
    }

    @Test
    void condition_booleanTree_isFullyParenthesized() {
        DataCondition condition = new DataCondition.And(
            new DataCondition.Or(equal("role", "admin"), equal("role", "owner")),
            new DataCondition.Not(compare("deleted", DataOperator.IS_NULL)));

        assertThat(queries.condition(condition)).isEqualTo(
            "(((__row__['role'] == 'admin') || (__row__['role'] == 'owner'))"
                + " && !(__row__['deleted'] === undefined || __row__['deleted'] === null))");
    }

    @Test
    void condition_textOperators_compareAsStrings() {
        assertThat(queries.condition(new DataCondition.Compare("name", DataOperator.STARTS_WITH,
            new StringLiteral("A"), null)))
            .isEqualTo("String(__row__['name'] ?? '').startsWith(String('A'))");
        assertThat(queries.condition(new DataCondition.Compare("email", DataOperator.MATCHES,
            new StringLiteral("@example\\.com$"), null)))
            .isEqualTo("new RegExp(String('@example\\\\.com$')).test(String(__row__['email'] ?? ''))");
    }

    @Test
    void condition_inList_testsEveryCandidate() {
        DataCondition in = new DataCondition.Compare("age", DataOperator.NOT_IN, null,
            List.of(NumberLiteral.of("18"), NumberLiteral.of("21")));

        assertThat(queries.condition(in)).isEqualTo("![18, 21].some((candidate) => candidate == __row__['age'])");
    }

    @Test
    void load_withoutWhere_returnsWholeTable() {
        assertThat(queries.load(TableRef.of("Products"), null)).isEqualTo("__table__('Products')");
    }

    private static DataQuery aggregate(TableRef table, String column, Aggregation aggregation) {
        return new DataQuery(table, null, column, null, List.of(), null, null, aggregation);
    }

    private static DataCondition equal(String column, String value) {
        return new DataCondition.Compare(column, DataOperator.EQUAL, new StringLiteral(value), null);
    }

    private static DataCondition compare(String column, DataOperator operator) {
        return new DataCondition.Compare(column, operator, null, null);
    }

    private static String literal(Expression expression) {
        if (expression instanceof StringLiteral string) {
            return TypeScript.quote(string.value());
        }
        return ((NumberLiteral) expression).text();
    }
}

package com.verolang.core.ast.query;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.verolang.core.ast.Expression;

import java.util.List;
import java.util.Objects;

/**
 * WHERE clause tree.
 *
 * <p>{@code AND} and {@code OR} have equal precedence and associate to the left:
 * {@code a OR b AND c} parses as {@code (a OR b) AND c}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "@type")
public sealed interface DataCondition
    permits DataCondition.Compare, DataCondition.And, DataCondition.Or, DataCondition.Not {

    /**
     * {@code column op value}. {@code value} is null for unary operators, {@code values} is
     * only used by {@code IN}/{@code NOT IN}.
     */
    record Compare(String column, DataOperator operator, Expression value, List<Expression> values)
        implements DataCondition {

        public Compare {
            Objects.requireNonNull(column, "column must not be null");
            Objects.requireNonNull(operator, "operator must not be null");
            values = values == null ? List.of() : List.copyOf(values);
        }
    }

    record And(DataCondition left, DataCondition right) implements DataCondition {
        public And {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    record Or(DataCondition left, DataCondition right) implements DataCondition {
        public Or {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    record Not(DataCondition condition) implements DataCondition {
        public Not {
            Objects.requireNonNull(condition, "condition must not be null");
        }
    }
}

package com.verolang.core.ast;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Objects;

/**
 * Condition of an {@code IF} statement.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "@type")
public sealed interface Condition permits Condition.ElementStateCondition, Condition.Comparison {

    /**
     * {@code IF target IS [NOT] state}.
     */
    record ElementStateCondition(Target target, boolean negated, ElementState state) implements Condition {
        public ElementStateCondition {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(state, "state must not be null");
        }
    }

    /**
     * {@code IF left op right}.
     */
    record Comparison(Expression left, ComparisonOperator operator, Expression right) implements Condition {
        public Comparison {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }
}

package com.verolang.core.ast.statement;

import com.verolang.core.ast.ElementState;
import com.verolang.core.ast.Expression;
import com.verolang.core.ast.Target;

import java.util.Objects;

/**
 * Element assertion: {@code VERIFY target IS NOT VISIBLE}, {@code VERIFY target HAS COUNT 3}, ...
 */
public record VerifyElementStatement(Target target, boolean negated, Check check, int line) implements Statement {

    public VerifyElementStatement {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(check, "check must not be null");
    }

    /**
     * The property being verified. {@code state} is set for
     * {@link VerifyElementStatement.Kind#STATE}, {@code value} for the others, {@code attribute}
     * only for {@link VerifyElementStatement.Kind#HAS_ATTRIBUTE}.
     */
    public record Check(Kind kind, ElementState state, Expression value, Expression attribute) {
        public Check {
            Objects.requireNonNull(kind, "kind must not be null");
        }

        public static Check state(ElementState state) {
            return new Check(Kind.STATE, Objects.requireNonNull(state, "state must not be null"), null, null);
        }

        public static Check of(Kind kind, Expression value) {
            return new Check(kind, null, Objects.requireNonNull(value, "value must not be null"), null);
        }

        public static Check attribute(Expression attribute, Expression value) {
            return new Check(Kind.HAS_ATTRIBUTE, null, value, attribute);
        }
    }

    public enum Kind {
        STATE,
        CONTAINS,
        HAS_TEXT,
        HAS_VALUE,
        HAS_ATTRIBUTE,
        HAS_COUNT,
        HAS_CLASS
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitVerifyElementStatement(this);
    }
}

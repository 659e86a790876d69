package com.verolang.core.ast.statement;

/**
 * {@code WAIT 2 SECONDS}. The unit defaults to seconds.
 */
public record WaitStatement(double amount, Unit unit, int line) implements Statement {

    public WaitStatement {
        if (unit == null) {
            unit = Unit.SECONDS;
        }
    }

    public long toMillis() {
        return unit == Unit.SECONDS ? Math.round(amount * 1000) : Math.round(amount);
    }

    public enum Unit {
        SECONDS,
        MILLISECONDS
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitWaitStatement(this);
    }
}

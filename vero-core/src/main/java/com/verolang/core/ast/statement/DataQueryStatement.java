package com.verolang.core.ast.statement;

import com.verolang.core.ast.query.DataQuery;
import com.verolang.core.ast.query.ResultType;

import java.util.Objects;

/**
 * A query bound to a variable: {@code ROW user = FIRST Users WHERE active = true},
 * {@code ROWS admins = Users WHERE role = "admin" LIMIT 5},
 * {@code NUMBER n = COUNT Users}, {@code TEXT email = FIRST Users.email}.
 */
public record DataQueryStatement(ResultType resultType, String variable, DataQuery query, int line) implements Statement {

    public DataQueryStatement {
        Objects.requireNonNull(resultType, "resultType must not be null");
        Objects.requireNonNull(variable, "variable must not be null");
        Objects.requireNonNull(query, "query must not be null");
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitDataQueryStatement(this);
    }
}

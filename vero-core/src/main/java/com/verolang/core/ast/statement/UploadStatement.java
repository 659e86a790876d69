package com.verolang.core.ast.statement;

import com.verolang.core.ast.Expression;
import com.verolang.core.ast.Target;

import java.util.List;
import java.util.Objects;

/**
 * {@code UPLOAD "a.pdf", "b.pdf" TO target}.
 */
public record UploadStatement(List<Expression> files, Target target, int line) implements Statement {

    public UploadStatement {
        Objects.requireNonNull(target, "target must not be null");
        files = files == null ? List.of() : List.copyOf(files);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitUploadStatement(this);
    }
}

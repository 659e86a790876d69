package com.verolang.core.ast.statement;

import com.verolang.core.ast.Target;

/**
 * {@code TAKE SCREENSHOT [OF target] [AS "file.png"]}. Both parts are optional.
 */
public record ScreenshotStatement(Target target, String filename, int line) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitScreenshotStatement(this);
    }
}

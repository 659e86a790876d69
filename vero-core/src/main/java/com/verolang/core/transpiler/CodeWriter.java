package com.verolang.core.transpiler;

/**
 * Line-oriented output buffer with block indentation.
 */
final class CodeWriter {

    private final StringBuilder out = new StringBuilder();
    private final String unit;
    private int depth;

    CodeWriter(int indent) {
        this.unit = " ".repeat(indent);
    }

    CodeWriter line(String text) {
        out.append(unit.repeat(depth)).append(text).append('\n');
        return this;
    }

    CodeWriter blank() {
        out.append('\n');
        return this;
    }

    /**
     * Writes {@code header} and indents what follows.
     */
    CodeWriter open(String header) {
        line(header);
        depth++;
        return this;
    }

    /**
     * Dedents and writes {@code footer}.
     */
    CodeWriter close(String footer) {
        if (depth == 0) {
            throw new IllegalStateException("close() without matching open()");
        }
        depth--;
        return line(footer);
    }

    /**
     * Closes one block and opens the next on the same line, as for an else branch.
     */
    CodeWriter reopen(String separator) {
        close(separator);
        depth++;
        return this;
    }

    /**
     * Appends pre-formatted text verbatim, e.g. the prelude.
     */
    CodeWriter raw(String text) {
        out.append(text);
        if (!text.endsWith("\n")) {
            out.append('\n');
        }
        return this;
    }

    @Override
    public String toString() {
        return out.toString();
    }
}

package com.verolang.core;

import com.verolang.core.transpiler.TranspileOptions;
import com.verolang.core.validator.ValidationContext;

/**
 * Options for {@link VeroCompiler#compile(String, CompileOptions)}.
 *
 * @param context pages and libraries declared in sibling files
 * @param transpile selection, combinations and formatting for code generation
 */
public record CompileOptions(ValidationContext context, TranspileOptions transpile) {

    public CompileOptions {
        if (context == null) {
            context = ValidationContext.empty();
        }
        if (transpile == null) {
            transpile = TranspileOptions.defaults();
        }
    }

    public static CompileOptions defaults() {
        return new CompileOptions(ValidationContext.empty(), TranspileOptions.defaults());
    }

    public CompileOptions withContext(ValidationContext newContext) {
        return new CompileOptions(newContext, transpile);
    }

    public CompileOptions withTranspile(TranspileOptions newTranspile) {
        return new CompileOptions(context, newTranspile);
    }
}

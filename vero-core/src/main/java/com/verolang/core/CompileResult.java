package com.verolang.core;

import com.verolang.core.error.VeroError;
import com.verolang.core.transpiler.TranspileResult;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a full compile.
 *
 * @param success whether code was generated
 * @param code generated script, or null on failure
 * @param result transpiler result with scenario counts, or null on failure
 * @param errors diagnostics of the stage that stopped the pipeline
 * @param warnings validator warnings, also present on success
 * @param stage last stage that ran
 */
public record CompileResult(
    boolean success,
    String code,
    TranspileResult result,
    List<VeroError> errors,
    List<VeroError> warnings,
    Stage stage
) {
    public CompileResult {
        Objects.requireNonNull(stage, "stage must not be null");
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    static CompileResult failure(Stage stage, List<VeroError> errors, List<VeroError> warnings) {
        return new CompileResult(false, null, null, errors, warnings, stage);
    }

    static CompileResult success(TranspileResult result, List<VeroError> warnings) {
        return new CompileResult(true, result.code(), result, List.of(), warnings, Stage.TRANSPILE);
    }

    /**
     * Pipeline stages in execution order.
     */
    public enum Stage {
        LEX,
        PARSE,
        VALIDATE,
        TRANSPILE
    }
}

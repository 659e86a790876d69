package com.verolang.core.validator;

import com.verolang.core.error.VeroError;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of {@link Validator#validate}.
 *
 * @param valid true when there are no errors; warnings never affect validity
 * @param errors diagnostics with severity error
 * @param warnings all other diagnostics
 */
public record ValidationResult(boolean valid, List<VeroError> errors, List<VeroError> warnings) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Splits diagnostics by severity.
     */
    public static ValidationResult of(List<VeroError> diagnostics) {
        List<VeroError> errors = new ArrayList<>();
        List<VeroError> warnings = new ArrayList<>();
        for (VeroError diagnostic : diagnostics) {
            if (diagnostic.isError()) {
                errors.add(diagnostic);
            } else {
                warnings.add(diagnostic);
            }
        }
        return new ValidationResult(errors.isEmpty(), errors, warnings);
    }

    /**
     * Errors followed by warnings.
     */
    public List<VeroError> all() {
        List<VeroError> all = new ArrayList<>(errors);
        all.addAll(warnings);
        return all;
    }
}

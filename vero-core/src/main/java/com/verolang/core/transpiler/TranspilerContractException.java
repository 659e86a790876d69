package com.verolang.core.transpiler;

/**
 * Raised when the transpiler meets a reference that validation should have rejected.
 *
 * <p>This signals a defect in the caller (an unvalidated or partially validated program), not
 * a user mistake, so it is never turned into a {@link com.verolang.core.error.VeroError}.
 */
public class TranspilerContractException extends IllegalStateException {

    public TranspilerContractException(String message) {
        super(message);
    }
}

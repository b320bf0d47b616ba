package com.vet.clinic.exception;

/**
 * Base type for every per-operation failure raised by the clinic engine.
 * <p>
 * Subclasses are unchecked and local: they describe why a single call was refused
 * and never leave the engine in a partially applied state.
 */
public abstract class ClinicException extends RuntimeException {

    protected ClinicException(String message) {
        super(message);
    }

    protected ClinicException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable, machine-readable name of the failure, e.g. {@code INVALID_TRANSITION}.
     */
    public abstract String getErrorCode();
}

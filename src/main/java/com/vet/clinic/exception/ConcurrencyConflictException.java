package com.vet.clinic.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when another writer updated the same record first.
 * Re-read the record and apply the change again.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class ConcurrencyConflictException extends ClinicException {

    public ConcurrencyConflictException(String message) {
        super(message);
    }

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "CONCURRENCY_CONFLICT";
    }
}

package com.vet.clinic.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when the caller's role or identity does not allow the requested operation.
 */
@ResponseStatus(HttpStatus.FORBIDDEN)
public class AccessDeniedException extends ClinicException {

    public AccessDeniedException(String message) {
        super(message);
    }

    public AccessDeniedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "ACCESS_DENIED";
    }
}

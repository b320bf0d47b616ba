package com.vet.clinic.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when a request is missing required fields or carries values that can never be valid.
 * The caller can correct the input and try again.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class ValidationException extends ClinicException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "VALIDATION_ERROR";
    }
}

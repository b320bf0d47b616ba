package com.vet.clinic.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when a status, payment or deduction change is not an edge of its state machine.
 * The record is left exactly as it was.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class InvalidTransitionException extends ClinicException {

    public InvalidTransitionException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "INVALID_TRANSITION";
    }
}

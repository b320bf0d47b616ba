package com.vet.clinic.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when an appointment, consumption line, item or profile id is unknown.
 */
@ResponseStatus(HttpStatus.NOT_FOUND)
public class NotFoundException extends ClinicException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "NOT_FOUND";
    }
}

package com.vet.clinic.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when a forecast is requested for an item with no confirmed usage history.
 */
@ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
public class InsufficientDataException extends ClinicException {

    public InsufficientDataException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "INSUFFICIENT_DATA";
    }
}

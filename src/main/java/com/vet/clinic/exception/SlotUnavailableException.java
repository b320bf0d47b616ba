package com.vet.clinic.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when a booking asks for a time the staff member's availability does not offer.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class SlotUnavailableException extends ClinicException {

    public SlotUnavailableException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "SLOT_UNAVAILABLE";
    }
}

package com.vet.clinic.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when confirming a consumption line would take an item's stock below zero.
 * The line stays pending until stock is corrected.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class InsufficientStockException extends ClinicException {

    public InsufficientStockException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "INSUFFICIENT_STOCK";
    }
}

package com.vet.clinic.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * One row of the payment ledger: an appointment with at least a deposit confirmed.
 * The amount is always the full service price.
 */
public record PaymentTransaction(String transactionId, Long appointmentId, String customerName,
                                 String serviceType, BigDecimal amount, LocalDate date,
                                 Instant confirmedAt, Status status) {

    public enum Status { COMPLETED, PENDING }
}

package com.vet.clinic.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Booking request. Field checks happen in the ledger so that every entry point,
 * not only HTTP, gets the same validation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentRequest {
    private String petName;
    private String ownerName;
    private String phone;
    private String email;
    private LocalDate date;
    private LocalTime time;
    private String staffMember;
    private String reason;
    private String notes;
    private String serviceType;
    private BigDecimal price;
}

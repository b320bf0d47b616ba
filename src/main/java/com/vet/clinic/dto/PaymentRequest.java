package com.vet.clinic.dto;

import com.vet.clinic.entity.Appointment;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentRequest {

    @NotNull(message = "Target payment status is required.")
    private Appointment.PaymentStatus paymentStatus;

    /** gcash, paymaya, at_clinic... Defaults to at_clinic. */
    private String method;

    /** Defaults to now. */
    private Instant confirmedAt;
}

package com.vet.clinic.dto;

import com.vet.clinic.entity.Appointment;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class StatusChangeRequest {
    @NotNull(message = "Target status is required.")
    private Appointment.Status status;
}

package com.vet.clinic.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalTime;

@Data
public class RescheduleRequest {
    @NotNull(message = "New date is required.")
    private LocalDate date;

    @NotNull(message = "New time is required.")
    private LocalTime time;
}

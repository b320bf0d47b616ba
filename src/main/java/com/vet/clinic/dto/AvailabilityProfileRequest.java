package com.vet.clinic.dto;

import lombok.Data;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Set;

@Data
public class AvailabilityProfileRequest {
    private Set<DayOfWeek> workingDays;
    private LocalTime startTime;
    private LocalTime endTime;
    private int appointmentDuration;
    private int breakTime;
    private LocalTime lunchStart;
    private LocalTime lunchEnd;
}

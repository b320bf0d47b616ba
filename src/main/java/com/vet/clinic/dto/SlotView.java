package com.vet.clinic.dto;

import java.time.LocalTime;

/** A generated slot and whether a new booking would currently be accepted there. */
public record SlotView(LocalTime time, boolean bookable, int bookings) {}

package com.vet.clinic.service;

import com.vet.clinic.entity.Appointment;
import com.vet.clinic.entity.AvailabilityProfile;
import com.vet.clinic.exception.SlotUnavailableException;
import com.vet.clinic.exception.ValidationException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Slot generation from a staff member's availability profile.
 * Stateless: same profile and date always give the same slots. Slots are advisory;
 * nothing is reserved by generating them.
 */
@Service
public class AvailabilityEngine {

    private static final int MINUTES_PER_DAY = 24 * 60;

    /**
     * Bookable start times for the given date, in ascending order. Empty on days the
     * staff member does not work. A slot overlapping the lunch window is dropped whole.
     */
    public List<LocalTime> generateSlots(AvailabilityProfile profile, LocalDate date) {
        if (profile == null || date == null) return List.of();
        if (profile.getWorkingDays() == null || !profile.getWorkingDays().contains(date.getDayOfWeek())) {
            return List.of();
        }
        int duration = profile.getAppointmentDuration();
        if (duration <= 0) return List.of();

        int start = minuteOfDay(profile.getStartTime());
        int end = minuteOfDay(profile.getEndTime());
        List<LocalTime> slots = new ArrayList<>();
        for (int t = start; t + duration <= end; t += duration) {
            if (overlapsLunch(profile, t, t + duration)) continue;
            slots.add(LocalTime.of(t / 60, t % 60));
        }
        return slots;
    }

    /**
     * A time is bookable when it is a generated slot and keeps {@code duration + breakTime}
     * minutes from every other active booking of the same staff member that day.
     * A booking at the identical start time does not block: double bookings are
     * accepted and surfaced for review.
     */
    public boolean isBookable(AvailabilityProfile profile, LocalDate date, LocalTime time,
                              Collection<Appointment> sameDayBookings) {
        return unavailableReason(profile, date, time, sameDayBookings) == null;
    }

    public void checkBookable(AvailabilityProfile profile, LocalDate date, LocalTime time,
                              Collection<Appointment> sameDayBookings) {
        String reason = unavailableReason(profile, date, time, sameDayBookings);
        if (reason != null) {
            throw new SlotUnavailableException(reason);
        }
    }

    private String unavailableReason(AvailabilityProfile profile, LocalDate date, LocalTime time,
                                     Collection<Appointment> sameDayBookings) {
        if (profile == null) throw new ValidationException("Availability profile is required.");
        if (date == null) return "No date requested.";
        if (time == null) return "No time requested.";
        if (!generateSlots(profile, date).contains(time)) {
            return String.format("%s is not a bookable slot for %s on %s.",
                    time, profile.getStaffMember(), date);
        }
        int candidate = minuteOfDay(time);
        int minGap = profile.getAppointmentDuration() + Math.max(0, profile.getBreakTime());
        for (Appointment other : sameDayBookings) {
            if (!other.isActive() || !date.equals(other.getDate())) continue;
            if (!StringUtils.equals(profile.getStaffMember(), other.getStaffMember())) continue;
            int existing = minuteOfDay(other.getTime());
            if (existing == candidate) continue;
            if (Math.abs(existing - candidate) < minGap) {
                return String.format("%s is within %d minutes of the booking at %s for %s.",
                        time, minGap, other.getTime(), profile.getStaffMember());
            }
        }
        return null;
    }

    /**
     * Rejects profiles that cannot produce a sane day: start must precede end, the
     * duration must be positive and the lunch window must sit inside working hours.
     */
    public void validateProfile(AvailabilityProfile profile) {
        if (profile == null) throw new ValidationException("Availability profile is required.");
        if (StringUtils.isBlank(profile.getStaffMember())) {
            throw new ValidationException("Staff member is required.");
        }
        if (profile.getStartTime() == null || profile.getEndTime() == null) {
            throw new ValidationException("Start and end time are required.");
        }
        if (!profile.getStartTime().isBefore(profile.getEndTime())) {
            throw new ValidationException("Start time must be before end time.");
        }
        if (profile.getAppointmentDuration() <= 0 || profile.getAppointmentDuration() > MINUTES_PER_DAY) {
            throw new ValidationException("Appointment duration must be a positive number of minutes.");
        }
        if (profile.getBreakTime() < 0) {
            throw new ValidationException("Break time cannot be negative.");
        }
        if (profile.getWorkingDays() == null || profile.getWorkingDays().isEmpty()) {
            throw new ValidationException("At least one working day is required.");
        }
        if (profile.getLunchStart() != null || profile.getLunchEnd() != null) {
            if (!profile.hasLunch()) {
                throw new ValidationException("Set both start and end time for the lunch break.");
            }
            if (!profile.getLunchStart().isBefore(profile.getLunchEnd())) {
                throw new ValidationException("Lunch start must be before lunch end.");
            }
            if (profile.getLunchStart().isBefore(profile.getStartTime())
                    || profile.getLunchEnd().isAfter(profile.getEndTime())) {
                throw new ValidationException("Lunch break must fall within working hours.");
            }
        }
    }

    private static boolean overlapsLunch(AvailabilityProfile profile, int slotStart, int slotEnd) {
        if (!profile.hasLunch()) return false;
        int lunchStart = minuteOfDay(profile.getLunchStart());
        int lunchEnd = minuteOfDay(profile.getLunchEnd());
        return slotStart < lunchEnd && lunchStart < slotEnd;
    }

    private static int minuteOfDay(LocalTime time) {
        return time.getHour() * 60 + time.getMinute();
    }
}

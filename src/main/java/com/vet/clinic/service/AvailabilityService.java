package com.vet.clinic.service;

import com.vet.clinic.auth.AccessContext;
import com.vet.clinic.dto.AvailabilityProfileRequest;
import com.vet.clinic.dto.SlotView;
import com.vet.clinic.entity.Appointment;
import com.vet.clinic.entity.AvailabilityProfile;
import com.vet.clinic.exception.NotFoundException;
import com.vet.clinic.exception.ValidationException;
import com.vet.clinic.repository.AppointmentRepository;
import com.vet.clinic.repository.AvailabilityProfileRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Stored availability profiles and the schedule view built from them.
 */
@Service
public class AvailabilityService {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityService.class);

    private final AvailabilityProfileRepository profileRepository;
    private final AppointmentRepository appointmentRepository;
    private final AvailabilityEngine availabilityEngine;

    public AvailabilityService(AvailabilityProfileRepository profileRepository,
                               AppointmentRepository appointmentRepository,
                               AvailabilityEngine availabilityEngine) {
        this.profileRepository = profileRepository;
        this.appointmentRepository = appointmentRepository;
        this.availabilityEngine = availabilityEngine;
    }

    @Transactional(readOnly = true)
    public AvailabilityProfile getProfile(String staffMember) {
        return profileRepository.findByStaffMember(staffMember)
                .orElseThrow(() -> new NotFoundException("No availability configured for " + staffMember + "."));
    }

    /**
     * Every generated slot of the day, flagged with whether it can still be booked
     * and how many active bookings already start there.
     */
    @Transactional(readOnly = true)
    public List<SlotView> slots(String staffMember, LocalDate date) {
        if (date == null) throw new ValidationException("Date is required.");
        AvailabilityProfile profile = getProfile(staffMember);
        List<Appointment> sameDay = appointmentRepository.findByStaffMemberAndDate(staffMember, date);

        List<SlotView> view = new ArrayList<>();
        for (LocalTime slot : availabilityEngine.generateSlots(profile, date)) {
            int bookings = (int) sameDay.stream()
                    .filter(Appointment::isActive)
                    .filter(a -> slot.equals(a.getTime()))
                    .count();
            view.add(new SlotView(slot, availabilityEngine.isBookable(profile, date, slot, sameDay), bookings));
        }
        return view;
    }

    /**
     * Creates or replaces the staff member's profile. Existing bookings are kept even
     * when they no longer fall on a generated slot.
     */
    @Transactional
    public AvailabilityProfile upsertProfile(AccessContext ctx, String staffMember, AvailabilityProfileRequest request) {
        ctx.requireClinicTeam("change availability");
        if (StringUtils.isBlank(staffMember)) throw new ValidationException("Staff member is required.");
        if (request == null) throw new ValidationException("Availability profile is required.");

        String name = staffMember.trim();
        AvailabilityProfile profile = profileRepository.findByStaffMember(name)
                .orElseGet(() -> AvailabilityProfile.builder().staffMember(name).build());
        profile.setWorkingDays(request.getWorkingDays() == null || request.getWorkingDays().isEmpty()
                ? EnumSet.noneOf(DayOfWeek.class)
                : EnumSet.copyOf(request.getWorkingDays()));
        profile.setStartTime(request.getStartTime());
        profile.setEndTime(request.getEndTime());
        profile.setAppointmentDuration(request.getAppointmentDuration());
        profile.setBreakTime(request.getBreakTime());
        profile.setLunchStart(request.getLunchStart());
        profile.setLunchEnd(request.getLunchEnd());
        availabilityEngine.validateProfile(profile);

        profile = profileRepository.save(profile);
        log.info("Availability for {} saved by {}: days={} {}-{} every {} min",
                name, ctx.identity(), profile.getWorkingDays(), profile.getStartTime(),
                profile.getEndTime(), profile.getAppointmentDuration());
        return profile;
    }
}

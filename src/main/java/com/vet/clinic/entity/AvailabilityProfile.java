package com.vet.clinic.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Weekly working pattern of one staff member. Slots are derived from it, never stored.
 */
@Entity
@Table(name = "availability_profile", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"staff_member"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AvailabilityProfile {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "staff_member", nullable = false, length = 100)
    private String staffMember;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "availability_working_day", joinColumns = @JoinColumn(name = "profile_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week", nullable = false, length = 10)
    @Builder.Default
    private Set<DayOfWeek> workingDays = EnumSet.noneOf(DayOfWeek.class);

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    /** Minutes per appointment; also the step between generated slots. */
    @Column(name = "appointment_duration", nullable = false)
    private int appointmentDuration;

    /** Minutes kept free between two bookings at different slots. */
    @Column(name = "break_time", nullable = false)
    private int breakTime;

    @Column(name = "lunch_start")
    private LocalTime lunchStart;

    @Column(name = "lunch_end")
    private LocalTime lunchEnd;

    public boolean hasLunch() {
        return lunchStart != null && lunchEnd != null;
    }
}

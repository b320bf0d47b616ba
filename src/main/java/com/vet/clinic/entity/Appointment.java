package com.vet.clinic.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Entity
@Table(name = "appointment", indexes = {
    @Index(name = "idx_appointment_date", columnList = "appointment_date"),
    @Index(name = "idx_appointment_email", columnList = "email"),
    @Index(name = "idx_appointment_staff", columnList = "staff_member, appointment_date")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Appointment {

    public enum Status { PENDING, APPROVED, REJECTED, CANCELLED, RESCHEDULED }

    public enum PaymentStatus { PENDING, DOWN_PAYMENT_PAID, FULLY_PAID }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "pet_name", nullable = false, length = 100)
    private String petName;

    @Column(name = "owner_name", nullable = false, length = 100)
    private String ownerName;

    @Column(nullable = false, length = 30)
    private String phone;

    /** Owner contact; the identity an owner's access context is matched against. */
    @Column(nullable = false, length = 150)
    private String email;

    @Column(name = "appointment_date", nullable = false)
    private LocalDate date;

    @Column(name = "appointment_time", nullable = false)
    private LocalTime time;

    @Column(name = "staff_member", nullable = false, length = 100)
    private String staffMember;

    @Column(length = 500)
    private String reason;

    @Column(length = 1000)
    private String notes;

    @Column(name = "service_type", length = 100)
    private String serviceType;

    /** Service price captured at booking time. */
    @Column(precision = 12, scale = 2)
    private BigDecimal price;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private Status status = Status.PENDING;

    /** Null until a payment workflow is started. */
    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status")
    private PaymentStatus paymentStatus;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "appointment_payment_event", joinColumns = @JoinColumn(name = "appointment_id"))
    @OrderColumn(name = "event_order")
    @Builder.Default
    private List<PaymentEvent> paymentEvents = new ArrayList<>();

    @OneToMany(mappedBy = "appointment", cascade = CascadeType.ALL, fetch = FetchType.EAGER)
    @OrderBy("id ASC")
    @Builder.Default
    private List<ConsumptionLine> consumptionLines = new ArrayList<>();

    /** Set on a booking created by rescheduling; points at the record it replaces. */
    @Column(name = "rescheduled_from_id")
    private Long rescheduledFromId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }

    public void addConsumptionLine(ConsumptionLine line) {
        line.setAppointment(this);
        consumptionLines.add(line);
    }

    public void appendPaymentEvent(PaymentEvent event) {
        paymentEvents.add(event);
    }

    public Optional<PaymentEvent> latestPaymentEvent(PaymentEvent.Kind kind) {
        PaymentEvent latest = null;
        for (PaymentEvent e : paymentEvents) {
            if (e.getKind() == kind) latest = e;
        }
        return Optional.ofNullable(latest);
    }

    /** Pending or approved bookings still hold their slot. */
    public boolean isActive() {
        return status == Status.PENDING || status == Status.APPROVED;
    }

    public boolean hasChargeablePrice() {
        return price != null && price.signum() > 0;
    }

    /**
     * The one definition of "this visit has been paid in full" used by every report.
     */
    public boolean isSettled() {
        if (status != Status.APPROVED || !hasChargeablePrice()) return false;
        return paymentStatus == PaymentStatus.FULLY_PAID
                || latestPaymentEvent(PaymentEvent.Kind.REMAINING_BALANCE).isPresent()
                || latestPaymentEvent(PaymentEvent.Kind.FULL_PAYMENT).isPresent();
    }
}

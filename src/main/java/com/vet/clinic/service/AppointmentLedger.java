package com.vet.clinic.service;

import com.vet.clinic.auth.AccessContext;
import com.vet.clinic.dto.AppointmentRequest;
import com.vet.clinic.dto.DeductionDecision;
import com.vet.clinic.dto.PaymentRequest;
import com.vet.clinic.entity.Appointment;
import com.vet.clinic.entity.AvailabilityProfile;
import com.vet.clinic.entity.ConsumptionLine;
import com.vet.clinic.entity.PaymentEvent;
import com.vet.clinic.exception.AccessDeniedException;
import com.vet.clinic.exception.ConcurrencyConflictException;
import com.vet.clinic.exception.InvalidTransitionException;
import com.vet.clinic.exception.NotFoundException;
import com.vet.clinic.exception.SlotUnavailableException;
import com.vet.clinic.exception.ValidationException;
import com.vet.clinic.repository.AppointmentRepository;
import com.vet.clinic.repository.AvailabilityProfileRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * System of record for appointments. Owns the status and payment state machines;
 * every mutation locks the appointment row and is refused, unchanged, when the
 * requested edge does not exist.
 */
@Service
public class AppointmentLedger {

    private static final Logger log = LoggerFactory.getLogger(AppointmentLedger.class);

    private static final Map<Appointment.Status, Set<Appointment.Status>> STATUS_EDGES =
            new EnumMap<>(Appointment.Status.class);

    static {
        STATUS_EDGES.put(Appointment.Status.PENDING, EnumSet.of(
                Appointment.Status.APPROVED, Appointment.Status.REJECTED, Appointment.Status.CANCELLED));
        STATUS_EDGES.put(Appointment.Status.APPROVED, EnumSet.of(
                Appointment.Status.CANCELLED, Appointment.Status.RESCHEDULED));
        STATUS_EDGES.put(Appointment.Status.REJECTED, EnumSet.noneOf(Appointment.Status.class));
        STATUS_EDGES.put(Appointment.Status.CANCELLED, EnumSet.noneOf(Appointment.Status.class));
        STATUS_EDGES.put(Appointment.Status.RESCHEDULED, EnumSet.noneOf(Appointment.Status.class));
    }

    private static final String DEFAULT_PAYMENT_METHOD = "at_clinic";

    private static final Comparator<Appointment> BY_SLOT = Comparator
            .comparing(Appointment::getDate)
            .thenComparing(Appointment::getTime)
            .thenComparing(Appointment::getId);

    private final AppointmentRepository appointmentRepository;
    private final AvailabilityProfileRepository profileRepository;
    private final AvailabilityEngine availabilityEngine;
    private final InventoryReconciler inventoryReconciler;
    private final Clock clock;

    public AppointmentLedger(AppointmentRepository appointmentRepository,
                             AvailabilityProfileRepository profileRepository,
                             AvailabilityEngine availabilityEngine,
                             InventoryReconciler inventoryReconciler,
                             Clock clock) {
        this.appointmentRepository = appointmentRepository;
        this.profileRepository = profileRepository;
        this.availabilityEngine = availabilityEngine;
        this.inventoryReconciler = inventoryReconciler;
        this.clock = clock;
    }

    public static boolean canTransition(Appointment.Status from, Appointment.Status to) {
        return STATUS_EDGES.getOrDefault(from, Set.of()).contains(to);
    }

    // =========================================================
    // BOOKING
    // =========================================================

    /**
     * Books a pending appointment. The slot must be offered by the staff member's
     * availability; an identical slot already taken by someone else is accepted and
     * shows up in {@link #findOverlapping}.
     */
    @Transactional
    public Appointment create(AccessContext ctx, AppointmentRequest request) {
        validate(request);
        ctx.requireOwnerOf(request.getEmail(), "book");

        String staffMember = request.getStaffMember().trim();
        checkSlot(staffMember, request.getDate(), request.getTime(), null);

        Appointment appointment = Appointment.builder()
                .petName(request.getPetName().trim())
                .ownerName(request.getOwnerName().trim())
                .phone(request.getPhone().trim())
                .email(request.getEmail().trim())
                .date(request.getDate())
                .time(request.getTime())
                .staffMember(staffMember)
                .reason(StringUtils.trimToNull(request.getReason()))
                .notes(StringUtils.trimToNull(request.getNotes()))
                .serviceType(StringUtils.trimToNull(request.getServiceType()))
                .price(request.getPrice())
                .status(Appointment.Status.PENDING)
                .createdAt(clock.instant())
                .build();
        appointment = appointmentRepository.save(appointment);

        log.info("Booked appointment {}: pet={} staff={} date={} time={} by={}",
                appointment.getId(), appointment.getPetName(), staffMember,
                appointment.getDate(), appointment.getTime(), ctx.identity());
        return appointment;
    }

    // =========================================================
    // STATUS
    // =========================================================

    /**
     * Moves the appointment along the status graph. Owners may only cancel their own
     * bookings. Confirmed consumption lines stay confirmed whatever the new status.
     */
    @Transactional
    public Appointment transitionStatus(AccessContext ctx, Long id, Appointment.Status target) {
        if (target == null) throw new ValidationException("Target status is required.");
        Appointment appointment = lockForUpdate(id);
        if (ctx.isOwner()) {
            ctx.requireOwnerOf(appointment.getEmail(), "change status");
            if (target != Appointment.Status.CANCELLED) {
                throw new AccessDeniedException("Owners may only cancel appointments.");
            }
        }
        Appointment.Status from = appointment.getStatus();
        requireEdge(appointment, target);

        appointment.setStatus(target);
        appointment = flush(appointment);
        log.info("Appointment {} status {} -> {} by {}", id, from, target, ctx.identity());
        return appointment;
    }

    /**
     * Closes an approved appointment as rescheduled and books its replacement as a new
     * pending record, so the original slot stays in history.
     *
     * @return the new appointment
     */
    @Transactional
    public Appointment reschedule(AccessContext ctx, Long id, LocalDate newDate, LocalTime newTime) {
        ctx.requireClinicTeam("reschedule appointments");
        if (newDate == null || newTime == null) {
            throw new ValidationException("New date and time are required.");
        }
        requireNotPast(newDate);
        Appointment old = lockForUpdate(id);
        requireEdge(old, Appointment.Status.RESCHEDULED);
        checkSlot(old.getStaffMember(), newDate, newTime, old.getId());

        old.setStatus(Appointment.Status.RESCHEDULED);
        flush(old);

        Appointment replacement = Appointment.builder()
                .petName(old.getPetName())
                .ownerName(old.getOwnerName())
                .phone(old.getPhone())
                .email(old.getEmail())
                .date(newDate)
                .time(newTime)
                .staffMember(old.getStaffMember())
                .reason(old.getReason())
                .notes(old.getNotes())
                .serviceType(old.getServiceType())
                .price(old.getPrice())
                .status(Appointment.Status.PENDING)
                .rescheduledFromId(old.getId())
                .createdAt(clock.instant())
                .build();
        replacement = appointmentRepository.save(replacement);

        log.info("Rescheduled appointment {} ({} {}) -> {} ({} {}) by {}",
                old.getId(), old.getDate(), old.getTime(),
                replacement.getId(), newDate, newTime, ctx.identity());
        return replacement;
    }

    // =========================================================
    // PAYMENT
    // =========================================================

    /**
     * Advances the payment state of an approved appointment and appends the matching
     * payment event: a deposit, a full payment, or the remaining balance after a deposit.
     * Opening the workflow ({@code PENDING}) records no event.
     * <p>
     * Owners may only pay the deposit on their own appointment, stamped with the current
     * time. Full payments and remaining balances are confirmed by clinic staff.
     */
    @Transactional
    public Appointment setPaymentStatus(AccessContext ctx, Long id, PaymentRequest payment) {
        if (payment == null || payment.getPaymentStatus() == null) {
            throw new ValidationException("Target payment status is required.");
        }
        Appointment.PaymentStatus target = payment.getPaymentStatus();
        Appointment appointment = lockForUpdate(id);
        ctx.requireOwnerOf(appointment.getEmail(), "record a payment");

        if (appointment.getStatus() != Appointment.Status.APPROVED) {
            throw new InvalidTransitionException(String.format(
                    "Payment can only be recorded on an approved appointment; %d is %s.",
                    id, appointment.getStatus()));
        }
        Appointment.PaymentStatus from = appointment.getPaymentStatus();
        PaymentEvent.Kind kind = paymentEventKind(from, target);
        if (kind == null && !(from == null && target == Appointment.PaymentStatus.PENDING)) {
            throw new InvalidTransitionException(String.format(
                    "Payment status cannot move from %s to %s on appointment %d.",
                    from == null ? "none" : from, target, id));
        }

        if (ctx.isOwner() && kind != PaymentEvent.Kind.DEPOSIT) {
            throw new AccessDeniedException("Owners may only pay the deposit; "
                    + target + " must be confirmed by clinic staff.");
        }

        if (kind != null) {
            Instant confirmedAt = ctx.isOwner() || payment.getConfirmedAt() == null
                    ? clock.instant()
                    : payment.getConfirmedAt();
            appointment.appendPaymentEvent(PaymentEvent.builder()
                    .kind(kind)
                    .confirmedAt(confirmedAt)
                    .method(StringUtils.defaultIfBlank(payment.getMethod(), DEFAULT_PAYMENT_METHOD).trim())
                    .confirmedBy(ctx.identity())
                    .build());
        }
        appointment.setPaymentStatus(target);
        appointment = flush(appointment);

        log.info("Appointment {} payment {} -> {} ({}) by {}",
                id, from == null ? "none" : from, target, kind, ctx.identity());
        return appointment;
    }

    /**
     * Event recorded for a payment edge, or {@code null} when the edge does not record
     * one (opening the workflow) or does not exist.
     */
    static PaymentEvent.Kind paymentEventKind(Appointment.PaymentStatus from, Appointment.PaymentStatus to) {
        boolean unpaid = from == null || from == Appointment.PaymentStatus.PENDING;
        if (unpaid && to == Appointment.PaymentStatus.DOWN_PAYMENT_PAID) return PaymentEvent.Kind.DEPOSIT;
        if (unpaid && to == Appointment.PaymentStatus.FULLY_PAID) return PaymentEvent.Kind.FULL_PAYMENT;
        if (from == Appointment.PaymentStatus.DOWN_PAYMENT_PAID && to == Appointment.PaymentStatus.FULLY_PAID) {
            return PaymentEvent.Kind.REMAINING_BALANCE;
        }
        return null;
    }

    // =========================================================
    // CONSUMPTION
    // =========================================================

    @Transactional
    public ConsumptionLine addConsumptionLine(AccessContext ctx, Long appointmentId, Long itemId, int quantity) {
        ctx.requireClinicTeam("log items used");
        return inventoryReconciler.logUsage(appointmentId, itemId, quantity);
    }

    @Transactional
    public ConsumptionLine decideConsumptionLine(AccessContext ctx, Long appointmentId, Long lineId,
                                                 DeductionDecision decision, String reason) {
        ctx.requireClinicTeam("approve or reject item deductions");
        if (decision == null) throw new ValidationException("Decision is required.");
        return decision == DeductionDecision.CONFIRM
                ? inventoryReconciler.confirm(appointmentId, lineId, ctx.identity())
                : inventoryReconciler.reject(appointmentId, lineId, reason);
    }

    // =========================================================
    // READS
    // =========================================================

    @Transactional(readOnly = true)
    public Appointment get(AccessContext ctx, Long id) {
        Appointment appointment = appointmentRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Appointment " + id + " not found."));
        ctx.requireOwnerOf(appointment.getEmail(), "view");
        return appointment;
    }

    @Transactional(readOnly = true)
    public List<Appointment> listAll(AccessContext ctx) {
        ctx.requireClinicTeam("list every appointment");
        return appointmentRepository.findAll().stream().sorted(BY_SLOT).toList();
    }

    /**
     * Owners see the appointments booked under their email; clinicians and staff see all.
     */
    @Transactional(readOnly = true)
    public List<Appointment> listVisibleTo(AccessContext ctx) {
        List<Appointment> all = ctx.isOwner()
                ? appointmentRepository.findByEmailIgnoreCase(ctx.identity())
                : appointmentRepository.findAll();
        return all.stream().sorted(BY_SLOT).toList();
    }

    @Transactional(readOnly = true)
    public List<Appointment> listByDate(AccessContext ctx, LocalDate date) {
        return appointmentRepository.findByDate(date).stream()
                .filter(a -> !ctx.isOwner() || ctx.ownsContact(a.getEmail()))
                .sorted(BY_SLOT)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Appointment> listByStaffMember(AccessContext ctx, String staffMember, LocalDate date) {
        ctx.requireClinicTeam("view staff schedules");
        return appointmentRepository.findByStaffMemberAndDate(staffMember, date).stream()
                .sorted(BY_SLOT)
                .toList();
    }

    /**
     * Other pending or approved bookings of the same staff member at the same date and
     * time, for staff to resolve by hand.
     */
    @Transactional(readOnly = true)
    public List<Appointment> findOverlapping(AccessContext ctx, Long id) {
        ctx.requireClinicTeam("review double bookings");
        Appointment appointment = get(ctx, id);
        return appointmentRepository.findByStaffMemberAndDate(appointment.getStaffMember(), appointment.getDate())
                .stream()
                .filter(Appointment::isActive)
                .filter(a -> !a.getId().equals(id))
                .filter(a -> a.getTime().equals(appointment.getTime()))
                .sorted(BY_SLOT)
                .toList();
    }

    // =========================================================
    // HELPERS
    // =========================================================

    private void validate(AppointmentRequest request) {
        if (request == null) throw new ValidationException("Appointment request is required.");
        requireText(request.getPetName(), "Pet name");
        requireText(request.getOwnerName(), "Owner name");
        requireText(request.getPhone(), "Phone");
        requireText(request.getEmail(), "Email");
        requireText(request.getStaffMember(), "Staff member");
        if (!request.getEmail().contains("@")) {
            throw new ValidationException("Email '" + request.getEmail() + "' is not a valid address.");
        }
        if (request.getDate() == null) throw new ValidationException("Date is required.");
        if (request.getTime() == null) throw new ValidationException("Time is required.");
        if (request.getPrice() != null && request.getPrice().compareTo(BigDecimal.ZERO) < 0) {
            throw new ValidationException("Price cannot be negative.");
        }
        requireNotPast(request.getDate());
    }

    private void requireNotPast(LocalDate date) {
        if (date.isBefore(LocalDate.now(clock))) {
            throw new ValidationException("Cannot book a date in the past: " + date + ".");
        }
    }

    private static void requireText(String value, String field) {
        if (StringUtils.isBlank(value)) {
            throw new ValidationException(field + " is required.");
        }
    }

    private void checkSlot(String staffMember, LocalDate date, LocalTime time, Long ignoreId) {
        AvailabilityProfile profile = profileRepository.findByStaffMember(staffMember)
                .orElseThrow(() -> new SlotUnavailableException("No availability configured for " + staffMember + "."));
        List<Appointment> sameDay = appointmentRepository.findByStaffMemberAndDate(staffMember, date).stream()
                .filter(a -> ignoreId == null || !a.getId().equals(ignoreId))
                .toList();
        availabilityEngine.checkBookable(profile, date, time, sameDay);
    }

    private Appointment lockForUpdate(Long id) {
        return appointmentRepository.findByIdForUpdate(id)
                .orElseThrow(() -> new NotFoundException("Appointment " + id + " not found."));
    }

    private static void requireEdge(Appointment appointment, Appointment.Status target) {
        if (!canTransition(appointment.getStatus(), target)) {
            throw new InvalidTransitionException(String.format(
                    "Appointment %d cannot move from %s to %s.", appointment.getId(), appointment.getStatus(), target));
        }
    }

    private Appointment flush(Appointment appointment) {
        try {
            return appointmentRepository.saveAndFlush(appointment);
        } catch (OptimisticLockingFailureException e) {
            throw new ConcurrencyConflictException("Appointment " + appointment.getId() + " was modified concurrently.", e);
        }
    }
}

package com.vet.clinic.controller;

import com.vet.clinic.auth.AccessContext;
import com.vet.clinic.dto.AppointmentRequest;
import com.vet.clinic.dto.AppointmentView;
import com.vet.clinic.dto.ConsumptionRequest;
import com.vet.clinic.dto.DeductionDecisionRequest;
import com.vet.clinic.dto.PaymentRequest;
import com.vet.clinic.dto.RescheduleRequest;
import com.vet.clinic.dto.StatusChangeRequest;
import com.vet.clinic.entity.Appointment;
import com.vet.clinic.entity.ConsumptionLine;
import com.vet.clinic.service.AppointmentLedger;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/appointments")
public class AppointmentController {

    private final AppointmentLedger ledger;

    public AppointmentController(AppointmentLedger ledger) {
        this.ledger = ledger;
    }

    @PostMapping
    public ResponseEntity<AppointmentView> create(AccessContext ctx, @RequestBody AppointmentRequest request) {
        Appointment created = ledger.create(ctx, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(AppointmentView.from(created));
    }

    /**
     * Appointments visible to the caller, optionally limited to one day.
     */
    @GetMapping
    public ResponseEntity<List<AppointmentView>> list(
            AccessContext ctx,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        List<Appointment> appointments = date != null ? ledger.listByDate(ctx, date) : ledger.listVisibleTo(ctx);
        return ResponseEntity.ok(appointments.stream().map(AppointmentView::from).toList());
    }

    @GetMapping("/staff/{staffMember}")
    public ResponseEntity<List<AppointmentView>> listByStaffMember(
            AccessContext ctx,
            @PathVariable String staffMember,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(ledger.listByStaffMember(ctx, staffMember, date).stream()
                .map(AppointmentView::from).toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<AppointmentView> get(AccessContext ctx, @PathVariable Long id) {
        return ResponseEntity.ok(AppointmentView.from(ledger.get(ctx, id)));
    }

    @GetMapping("/{id}/overlaps")
    public ResponseEntity<List<AppointmentView>> overlaps(AccessContext ctx, @PathVariable Long id) {
        return ResponseEntity.ok(ledger.findOverlapping(ctx, id).stream().map(AppointmentView::from).toList());
    }

    @PostMapping("/{id}/status")
    public ResponseEntity<AppointmentView> changeStatus(AccessContext ctx, @PathVariable Long id,
                                                        @Valid @RequestBody StatusChangeRequest request) {
        return ResponseEntity.ok(AppointmentView.from(ledger.transitionStatus(ctx, id, request.getStatus())));
    }

    /**
     * Returns the new booking; the original is left as RESCHEDULED.
     */
    @PostMapping("/{id}/reschedule")
    public ResponseEntity<AppointmentView> reschedule(AccessContext ctx, @PathVariable Long id,
                                                      @Valid @RequestBody RescheduleRequest request) {
        Appointment replacement = ledger.reschedule(ctx, id, request.getDate(), request.getTime());
        return ResponseEntity.status(HttpStatus.CREATED).body(AppointmentView.from(replacement));
    }

    @PostMapping("/{id}/payment")
    public ResponseEntity<AppointmentView> payment(AccessContext ctx, @PathVariable Long id,
                                                   @Valid @RequestBody PaymentRequest request) {
        return ResponseEntity.ok(AppointmentView.from(ledger.setPaymentStatus(ctx, id, request)));
    }

    @PostMapping("/{id}/consumption")
    public ResponseEntity<AppointmentView.ConsumptionLineView> logConsumption(
            AccessContext ctx, @PathVariable Long id, @Valid @RequestBody ConsumptionRequest request) {
        ConsumptionLine line = ledger.addConsumptionLine(ctx, id, request.getItemId(), request.getQuantity());
        return ResponseEntity.status(HttpStatus.CREATED).body(AppointmentView.ConsumptionLineView.from(line));
    }

    @PostMapping("/{id}/consumption/{lineId}/decision")
    public ResponseEntity<AppointmentView.ConsumptionLineView> decide(
            AccessContext ctx, @PathVariable Long id, @PathVariable Long lineId,
            @Valid @RequestBody DeductionDecisionRequest request) {
        ConsumptionLine line = ledger.decideConsumptionLine(ctx, id, lineId, request.getDecision(), request.getReason());
        return ResponseEntity.ok(AppointmentView.ConsumptionLineView.from(line));
    }
}

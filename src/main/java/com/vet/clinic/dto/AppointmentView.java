package com.vet.clinic.dto;

import com.vet.clinic.entity.Appointment;
import com.vet.clinic.entity.ConsumptionLine;
import com.vet.clinic.entity.PaymentEvent;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

public record AppointmentView(
        Long id,
        String petName,
        String ownerName,
        String phone,
        String email,
        LocalDate date,
        LocalTime time,
        String staffMember,
        String reason,
        String notes,
        String serviceType,
        BigDecimal price,
        Appointment.Status status,
        Appointment.PaymentStatus paymentStatus,
        boolean settled,
        Long rescheduledFromId,
        List<PaymentEventView> paymentEvents,
        List<ConsumptionLineView> consumptionLines
) {

    public static AppointmentView from(Appointment a) {
        return new AppointmentView(
                a.getId(), a.getPetName(), a.getOwnerName(), a.getPhone(), a.getEmail(),
                a.getDate(), a.getTime(), a.getStaffMember(), a.getReason(), a.getNotes(),
                a.getServiceType(), a.getPrice(), a.getStatus(), a.getPaymentStatus(),
                a.isSettled(), a.getRescheduledFromId(),
                a.getPaymentEvents().stream().map(PaymentEventView::from).toList(),
                a.getConsumptionLines().stream().map(ConsumptionLineView::from).toList()
        );
    }

    public record PaymentEventView(PaymentEvent.Kind kind, Instant confirmedAt, String method, String confirmedBy) {
        static PaymentEventView from(PaymentEvent e) {
            return new PaymentEventView(e.getKind(), e.getConfirmedAt(), e.getMethod(), e.getConfirmedBy());
        }
    }

    public record ConsumptionLineView(Long id, Long itemId, String itemName, String itemCategory, int quantity,
                                      ConsumptionLine.DeductionStatus deductionStatus, Instant loggedAt,
                                      String rejectedReason, String approvedBy, Instant approvedAt) {
        public static ConsumptionLineView from(ConsumptionLine l) {
            return new ConsumptionLineView(l.getId(), l.getItemId(), l.getItemName(), l.getItemCategory(),
                    l.getQuantity(), l.getDeductionStatus(), l.getLoggedAt(), l.getRejectedReason(),
                    l.getApprovedBy(), l.getApprovedAt());
        }
    }
}

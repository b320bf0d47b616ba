package com.vet.clinic.service;

import com.vet.clinic.entity.Appointment;
import com.vet.clinic.entity.ConsumptionLine;
import com.vet.clinic.entity.InventoryItem;
import com.vet.clinic.exception.ConcurrencyConflictException;
import com.vet.clinic.exception.InsufficientStockException;
import com.vet.clinic.exception.InvalidTransitionException;
import com.vet.clinic.exception.NotFoundException;
import com.vet.clinic.exception.ValidationException;
import com.vet.clinic.repository.AppointmentRepository;
import com.vet.clinic.repository.ConsumptionLineRepository;
import com.vet.clinic.repository.InventoryItemRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;

/**
 * Item usage logged against appointments and its approval.
 * Stock only moves when a pending line is confirmed, and only once per line: the
 * pending check runs under a row lock, so a retried or concurrent confirm sees the
 * line already decided.
 */
@Service
public class InventoryReconciler {

    private static final Logger log = LoggerFactory.getLogger(InventoryReconciler.class);

    private final AppointmentRepository appointmentRepository;
    private final ConsumptionLineRepository lineRepository;
    private final InventoryItemRepository itemRepository;
    private final Clock clock;

    public InventoryReconciler(AppointmentRepository appointmentRepository,
                               ConsumptionLineRepository lineRepository,
                               InventoryItemRepository itemRepository,
                               Clock clock) {
        this.appointmentRepository = appointmentRepository;
        this.lineRepository = lineRepository;
        this.itemRepository = itemRepository;
        this.clock = clock;
    }

    /**
     * Appends a pending line to the appointment. Stock is untouched until approval.
     */
    @Transactional
    public ConsumptionLine logUsage(Long appointmentId, Long itemId, int quantity) {
        if (quantity <= 0) {
            throw new ValidationException("Quantity must be greater than zero, got " + quantity + ".");
        }
        if (itemId == null) {
            throw new ValidationException("Item id is required.");
        }
        Appointment appointment = appointmentRepository.findByIdForUpdate(appointmentId)
                .orElseThrow(() -> new NotFoundException("Appointment " + appointmentId + " not found."));
        InventoryItem item = itemRepository.findById(itemId)
                .orElseThrow(() -> new NotFoundException("Inventory item " + itemId + " not found."));

        ConsumptionLine line = ConsumptionLine.builder()
                .itemId(item.getId())
                .itemName(item.getName())
                .itemCategory(item.getCategory())
                .quantity(quantity)
                .deductionStatus(ConsumptionLine.DeductionStatus.PENDING)
                .loggedAt(clock.instant())
                .build();
        appointment.addConsumptionLine(line);
        line = flush(line);

        log.info("Logged usage: appointment={} item={} qty={} line={}", appointmentId, item.getName(), quantity, line.getId());
        return line;
    }

    /**
     * Pending to confirmed, deducting the line's quantity from stock in the same transaction.
     */
    @Transactional
    public ConsumptionLine confirm(Long lineId, String approver) {
        return confirm(null, lineId, approver);
    }

    /**
     * As {@link #confirm(Long, String)}, refusing a line that belongs to another appointment.
     */
    @Transactional
    public ConsumptionLine confirm(Long appointmentId, Long lineId, String approver) {
        ConsumptionLine line = lockLine(appointmentId, lineId);
        requirePending(line, "confirm");

        InventoryItem item = itemRepository.findByIdForUpdate(line.getItemId())
                .orElseThrow(() -> new NotFoundException("Inventory item " + line.getItemId() + " not found."));
        if (item.getStock() < line.getQuantity()) {
            throw new InsufficientStockException(String.format(
                    "Insufficient stock for %s. Required: %d, Available: %d",
                    item.getName(), line.getQuantity(), item.getStock()));
        }

        int before = item.getStock();
        item.setStock(before - line.getQuantity());
        line.setDeductionStatus(ConsumptionLine.DeductionStatus.CONFIRMED);
        line.setApprovedBy(approver);
        line.setApprovedAt(clock.instant());
        try {
            itemRepository.saveAndFlush(item);
        } catch (OptimisticLockingFailureException e) {
            throw new ConcurrencyConflictException("Inventory item " + item.getId() + " was modified concurrently.", e);
        }
        ConsumptionLine saved = flush(line);

        log.info("Confirmed line {}: {} stock {} -> {} by {}", lineId, item.getName(), before, item.getStock(), approver);
        return saved;
    }

    /**
     * Pending to rejected. Never touches stock.
     */
    @Transactional
    public ConsumptionLine reject(Long lineId, String reason) {
        return reject(null, lineId, reason);
    }

    @Transactional
    public ConsumptionLine reject(Long appointmentId, Long lineId, String reason) {
        ConsumptionLine line = lockLine(appointmentId, lineId);
        requirePending(line, "reject");

        line.setDeductionStatus(ConsumptionLine.DeductionStatus.REJECTED);
        line.setRejectedReason(StringUtils.trimToNull(reason));
        ConsumptionLine saved = flush(line);

        log.info("Rejected line {} ({} x{}): {}", lineId, line.getItemName(), line.getQuantity(), saved.getRejectedReason());
        return saved;
    }

    /**
     * Lines still waiting for a staff decision, oldest first.
     */
    @Transactional(readOnly = true)
    public List<ConsumptionLine> pendingLines() {
        return lineRepository.findWithAppointmentByStatus(ConsumptionLine.DeductionStatus.PENDING).stream()
                .sorted(Comparator.comparing(ConsumptionLine::getLoggedAt).thenComparing(ConsumptionLine::getId))
                .toList();
    }

    private ConsumptionLine lockLine(Long appointmentId, Long lineId) {
        ConsumptionLine line = lineRepository.findByIdForUpdate(lineId)
                .orElseThrow(() -> new NotFoundException("Consumption line " + lineId + " not found."));
        if (appointmentId != null && !appointmentId.equals(line.getAppointment().getId())) {
            throw new NotFoundException("Consumption line " + lineId + " not found on appointment " + appointmentId + ".");
        }
        return line;
    }

    private static void requirePending(ConsumptionLine line, String action) {
        if (!line.isPending()) {
            throw new InvalidTransitionException(String.format(
                    "Cannot %s consumption line %d: it is already %s.", action, line.getId(), line.getDeductionStatus()));
        }
    }

    private ConsumptionLine flush(ConsumptionLine line) {
        try {
            return lineRepository.saveAndFlush(line);
        } catch (OptimisticLockingFailureException e) {
            throw new ConcurrencyConflictException("Consumption line " + line.getId() + " was modified concurrently.", e);
        }
    }
}

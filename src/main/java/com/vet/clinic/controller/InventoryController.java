package com.vet.clinic.controller;

import com.vet.clinic.auth.AccessContext;
import com.vet.clinic.dto.AppointmentView;
import com.vet.clinic.entity.InventoryItem;
import com.vet.clinic.repository.InventoryItemRepository;
import com.vet.clinic.service.InventoryReconciler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/inventory")
public class InventoryController {

    private final InventoryReconciler inventoryReconciler;
    private final InventoryItemRepository itemRepository;

    public InventoryController(InventoryReconciler inventoryReconciler, InventoryItemRepository itemRepository) {
        this.inventoryReconciler = inventoryReconciler;
        this.itemRepository = itemRepository;
    }

    @GetMapping("/items")
    public ResponseEntity<List<InventoryItem>> items(AccessContext ctx) {
        ctx.requireClinicTeam("view inventory");
        return ResponseEntity.ok(itemRepository.findAllByOrderByNameAsc());
    }

    /** Deductions waiting for approval, oldest first. */
    @GetMapping("/pending-deductions")
    public ResponseEntity<List<AppointmentView.ConsumptionLineView>> pendingDeductions(AccessContext ctx) {
        ctx.requireClinicTeam("review item deductions");
        return ResponseEntity.ok(inventoryReconciler.pendingLines().stream()
                .map(AppointmentView.ConsumptionLineView::from)
                .toList());
    }
}

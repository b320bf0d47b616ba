package com.vet.clinic.controller;

import com.vet.clinic.auth.AccessContext;
import com.vet.clinic.dto.AduEntry;
import com.vet.clinic.dto.PaymentTransaction;
import com.vet.clinic.dto.RevenueSeries;
import com.vet.clinic.dto.ServiceShare;
import com.vet.clinic.dto.StockoutProjection;
import com.vet.clinic.service.ConsumptionForecaster;
import com.vet.clinic.service.RevenueAttributor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * Read-only report series for the clinic dashboards. Staff and clinicians only.
 */
@RestController
@RequestMapping("/api/reports")
public class ReportController {

    private final RevenueAttributor revenueAttributor;
    private final ConsumptionForecaster consumptionForecaster;

    public ReportController(RevenueAttributor revenueAttributor, ConsumptionForecaster consumptionForecaster) {
        this.revenueAttributor = revenueAttributor;
        this.consumptionForecaster = consumptionForecaster;
    }

    @GetMapping("/revenue")
    public ResponseEntity<RevenueSeries> revenue(AccessContext ctx,
                                                 @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                                 @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        ctx.requireClinicTeam("view revenue reports");
        return ResponseEntity.ok(revenueAttributor.recognizedRevenue(from, to));
    }

    @GetMapping("/services")
    public ResponseEntity<List<ServiceShare>> services(AccessContext ctx,
                                                       @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                                       @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        ctx.requireClinicTeam("view service reports");
        return ResponseEntity.ok(revenueAttributor.serviceDistribution(from, to));
    }

    @GetMapping("/transactions")
    public ResponseEntity<List<PaymentTransaction>> transactions(AccessContext ctx,
                                                                 @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                                                 @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        ctx.requireClinicTeam("view payment transactions");
        return ResponseEntity.ok(revenueAttributor.paymentTransactions(from, to));
    }

    @GetMapping("/adu")
    public ResponseEntity<List<AduEntry>> averageDailyUse(AccessContext ctx) {
        ctx.requireClinicTeam("view inventory forecasts");
        return ResponseEntity.ok(consumptionForecaster.averageDailyUseReport());
    }

    @GetMapping("/stockout/{itemId}")
    public ResponseEntity<StockoutProjection> stockout(AccessContext ctx, @PathVariable Long itemId) {
        ctx.requireClinicTeam("view inventory forecasts");
        return ResponseEntity.ok(consumptionForecaster.stockoutProjection(itemId));
    }
}

package com.vet.clinic.service;

import com.vet.clinic.dto.AduEntry;
import com.vet.clinic.dto.StockStatus;
import com.vet.clinic.dto.StockoutProjection;
import com.vet.clinic.entity.ConsumptionLine;
import com.vet.clinic.entity.InventoryItem;
import com.vet.clinic.exception.InsufficientDataException;
import com.vet.clinic.exception.NotFoundException;
import com.vet.clinic.repository.ConsumptionLineRepository;
import com.vet.clinic.repository.InventoryItemRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Stock depletion forecasts built from confirmed consumption only. Pending and
 * rejected lines never count as usage.
 */
@Service
public class ConsumptionForecaster {

    /** Thresholds for items without a reorder point. */
    static final int DEFAULT_REORDER_LEVEL = 10;
    static final int DEFAULT_MONITOR_LEVEL = 20;

    private final ConsumptionLineRepository lineRepository;
    private final InventoryItemRepository itemRepository;
    private final Clock clock;
    private final double monitorFactor;

    public ConsumptionForecaster(ConsumptionLineRepository lineRepository,
                                 InventoryItemRepository itemRepository,
                                 Clock clock,
                                 @Value("${clinic.forecast.monitor-factor:1.2}") double monitorFactor) {
        this.lineRepository = lineRepository;
        this.itemRepository = itemRepository;
        this.clock = clock;
        this.monitorFactor = monitorFactor;
    }

    /**
     * Confirmed quantity of the item divided by the number of distinct appointment
     * dates it was used on. Zero when it was never used.
     */
    @Transactional(readOnly = true)
    public double averageDailyUse(String itemName) {
        return averageDailyUse(lineRepository.findWithAppointmentByItemNameAndStatus(
                itemName, ConsumptionLine.DeductionStatus.CONFIRMED));
    }

    static double averageDailyUse(Collection<ConsumptionLine> lines) {
        long total = 0;
        Set<LocalDate> days = new HashSet<>();
        for (ConsumptionLine line : lines) {
            if (line.getDeductionStatus() != ConsumptionLine.DeductionStatus.CONFIRMED) continue;
            total += line.getQuantity();
            days.add(line.getAppointment().getDate());
        }
        return days.isEmpty() ? 0.0 : (double) total / days.size();
    }

    @Transactional(readOnly = true)
    public List<AduEntry> averageDailyUseReport() {
        List<AduEntry> report = new ArrayList<>();
        for (InventoryItem item : itemRepository.findAllByOrderByNameAsc()) {
            double adu = round2(averageDailyUse(item.getName()));
            report.add(new AduEntry(item.getId(), item.getName(), item.getCategory(), adu,
                    item.getStock(), classify(item)));
        }
        return report;
    }

    @Transactional(readOnly = true)
    public StockoutProjection stockoutProjection(Long itemId) {
        InventoryItem item = itemRepository.findById(itemId)
                .orElseThrow(() -> new NotFoundException("Inventory item " + itemId + " not found."));
        return project(item, averageDailyUse(item.getName()));
    }

    /**
     * Linear depletion at {@code adu} per day starting today. The reorder-by date is
     * the stockout date minus the supplier lead time.
     */
    public StockoutProjection project(InventoryItem item, double adu) {
        if (adu <= 0) {
            throw new InsufficientDataException("No confirmed usage recorded for " + item.getName()
                    + "; cannot project a stockout date.");
        }
        int stock = item.getStock();
        long daysUntilStockout = (long) Math.ceil(stock / adu);
        LocalDate today = LocalDate.now(clock);

        List<StockoutProjection.Point> points = new ArrayList<>();
        for (long d = 0; d <= daysUntilStockout; d++) {
            double projected = Math.max(0.0, stock - adu * d);
            points.add(new StockoutProjection.Point(d, today.plusDays(d), round2(projected)));
        }

        LocalDate stockoutDate = today.plusDays(daysUntilStockout);
        LocalDate reorderBy = item.getLeadTime() != null ? stockoutDate.minusDays(item.getLeadTime()) : null;
        Integer suggested = item.getTargetLevel() != null ? Math.max(0, item.getTargetLevel() - stock) : null;

        return new StockoutProjection(item.getId(), item.getName(), stock, round2(adu), daysUntilStockout,
                stockoutDate, reorderBy, item.getReorderPoint(), item.getSafetyStock(), suggested,
                classify(item), points);
    }

    public StockStatus classify(InventoryItem item) {
        int stock = item.getStock();
        Integer rop = item.getReorderPoint();
        if (rop != null && rop > 0) {
            if (stock <= rop) return StockStatus.REORDER_NOW;
            if (stock <= rop * monitorFactor) return StockStatus.MONITOR;
            return StockStatus.SAFE;
        }
        if (stock < DEFAULT_REORDER_LEVEL) return StockStatus.REORDER_NOW;
        if (stock < DEFAULT_MONITOR_LEVEL) return StockStatus.MONITOR;
        return StockStatus.SAFE;
    }

    private static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}

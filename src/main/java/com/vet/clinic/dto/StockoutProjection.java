package com.vet.clinic.dto;

import java.time.LocalDate;
import java.util.List;

/**
 * Linear depletion of one item at its average daily use, from today (day 0) to the
 * day stock reaches zero. Reorder point and safety stock are the reference lines.
 */
public record StockoutProjection(
        Long itemId,
        String itemName,
        int currentStock,
        double averageDailyUse,
        long daysUntilStockout,
        LocalDate projectedStockoutDate,
        LocalDate reorderByDate,
        Integer reorderPoint,
        Integer safetyStock,
        Integer suggestedOrderQuantity,
        StockStatus status,
        List<Point> points
) {
    public record Point(long day, LocalDate date, double projectedStock) {}
}

package com.vet.clinic.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Recognized revenue for a period, one bucket per day or per month.
 */
public record RevenueSeries(LocalDate from, LocalDate to, Granularity granularity,
                            List<Bucket> buckets, BigDecimal total) {

    public enum Granularity { DAY, MONTH }

    /** {@code start} is the day itself, or the first day of the month. */
    public record Bucket(LocalDate start, String label, BigDecimal revenue, int appointments) {}

    public BigDecimal revenueFor(LocalDate bucketStart) {
        return buckets.stream()
                .filter(b -> b.start().equals(bucketStart))
                .map(Bucket::revenue)
                .findFirst()
                .orElse(BigDecimal.ZERO);
    }
}

package com.vet.clinic.service;

import com.vet.clinic.dto.PaymentTransaction;
import com.vet.clinic.dto.RevenueSeries;
import com.vet.clinic.dto.ServiceShare;
import com.vet.clinic.entity.Appointment;
import com.vet.clinic.entity.PaymentEvent;
import com.vet.clinic.exception.ValidationException;
import com.vet.clinic.repository.AppointmentRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Revenue reporting over settled appointments. Read-only: reports are recomputed from
 * the ledger on every call, so the same data always gives the same figures.
 * An appointment contributes its full price once, on the day it was settled.
 */
@Service
public class RevenueAttributor {

    private static final Logger log = LoggerFactory.getLogger(RevenueAttributor.class);

    static final String UNSPECIFIED_SERVICE = "unspecified";

    private final AppointmentRepository appointmentRepository;
    private final Clock clock;
    private final int dailyBucketMaxDays;

    public RevenueAttributor(AppointmentRepository appointmentRepository,
                             Clock clock,
                             @Value("${clinic.revenue.daily-bucket-max-days:60}") int dailyBucketMaxDays) {
        this.appointmentRepository = appointmentRepository;
        this.clock = clock;
        this.dailyBucketMaxDays = dailyBucketMaxDays;
    }

    /**
     * Day the revenue of a settled appointment belongs to: the remaining-balance
     * confirmation, else the full-payment confirmation, else the visit date.
     */
    public LocalDate recognitionDate(Appointment appointment) {
        Optional<PaymentEvent> settling = appointment.latestPaymentEvent(PaymentEvent.Kind.REMAINING_BALANCE)
                .or(() -> appointment.latestPaymentEvent(PaymentEvent.Kind.FULL_PAYMENT));
        return settling
                .map(PaymentEvent::getConfirmedAt)
                .map(this::toLocalDate)
                .orElse(appointment.getDate());
    }

    @Transactional(readOnly = true)
    public RevenueSeries recognizedRevenue(LocalDate from, LocalDate to) {
        return recognizedRevenue(appointmentRepository.findByStatus(Appointment.Status.APPROVED), from, to);
    }

    /**
     * Buckets settled appointments by recognition date. Periods up to the configured
     * length get one bucket per day, longer ones one per calendar month; every bucket
     * of the period is present even when empty.
     */
    public RevenueSeries recognizedRevenue(Collection<Appointment> appointments, LocalDate from, LocalDate to) {
        requirePeriod(from, to);
        long days = ChronoUnit.DAYS.between(from, to) + 1;
        RevenueSeries.Granularity granularity = days <= dailyBucketMaxDays
                ? RevenueSeries.Granularity.DAY
                : RevenueSeries.Granularity.MONTH;

        Map<LocalDate, BigDecimal> revenue = new LinkedHashMap<>();
        Map<LocalDate, Integer> counts = new LinkedHashMap<>();
        if (granularity == RevenueSeries.Granularity.DAY) {
            for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
                revenue.put(d, BigDecimal.ZERO);
                counts.put(d, 0);
            }
        } else {
            for (YearMonth m = YearMonth.from(from); !m.isAfter(YearMonth.from(to)); m = m.plusMonths(1)) {
                revenue.put(m.atDay(1), BigDecimal.ZERO);
                counts.put(m.atDay(1), 0);
            }
        }

        BigDecimal total = BigDecimal.ZERO;
        for (Appointment a : appointments) {
            if (!a.isSettled()) continue;
            LocalDate recognized = recognitionDate(a);
            if (recognized.isBefore(from) || recognized.isAfter(to)) continue;
            LocalDate key = granularity == RevenueSeries.Granularity.DAY
                    ? recognized
                    : recognized.withDayOfMonth(1);
            revenue.merge(key, a.getPrice(), BigDecimal::add);
            counts.merge(key, 1, Integer::sum);
            total = total.add(a.getPrice());
        }

        List<RevenueSeries.Bucket> buckets = new ArrayList<>(revenue.size());
        revenue.forEach((start, amount) -> buckets.add(new RevenueSeries.Bucket(
                start, label(start, granularity), amount, counts.get(start))));

        log.debug("Revenue {}..{} ({}): {} buckets, total {}", from, to, granularity, buckets.size(), total);
        return new RevenueSeries(from, to, granularity, buckets, total);
    }

    @Transactional(readOnly = true)
    public List<ServiceShare> serviceDistribution(LocalDate from, LocalDate to) {
        return serviceDistribution(appointmentRepository.findByStatus(Appointment.Status.APPROVED), from, to);
    }

    /**
     * Settled appointments in the period grouped by service, most frequent first.
     * Percentages are shares of the appointment count, to one decimal.
     */
    public List<ServiceShare> serviceDistribution(Collection<Appointment> appointments, LocalDate from, LocalDate to) {
        requirePeriod(from, to);
        Map<String, Integer> counts = new LinkedHashMap<>();
        Map<String, BigDecimal> revenue = new LinkedHashMap<>();
        int total = 0;
        for (Appointment a : appointments) {
            if (!a.isSettled()) continue;
            LocalDate recognized = recognitionDate(a);
            if (recognized.isBefore(from) || recognized.isAfter(to)) continue;
            String service = StringUtils.defaultIfBlank(a.getServiceType(), UNSPECIFIED_SERVICE);
            counts.merge(service, 1, Integer::sum);
            revenue.merge(service, a.getPrice(), BigDecimal::add);
            total++;
        }

        List<ServiceShare> shares = new ArrayList<>();
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            double percentage = BigDecimal.valueOf(e.getValue() * 100.0 / total)
                    .setScale(1, RoundingMode.HALF_UP)
                    .doubleValue();
            shares.add(new ServiceShare(e.getKey(), e.getValue(), revenue.get(e.getKey()), percentage));
        }
        shares.sort(Comparator.comparingInt(ServiceShare::count).reversed()
                .thenComparing(ServiceShare::serviceType));
        return shares;
    }

    @Transactional(readOnly = true)
    public List<PaymentTransaction> paymentTransactions(LocalDate from, LocalDate to) {
        return paymentTransactions(appointmentRepository.findByStatus(Appointment.Status.APPROVED), from, to);
    }

    /**
     * Approved, priced appointments with at least a deposit, newest first. Unlike the
     * revenue figures these include deposit-only visits, shown as pending.
     */
    public List<PaymentTransaction> paymentTransactions(Collection<Appointment> appointments, LocalDate from, LocalDate to) {
        requirePeriod(from, to);
        List<PaymentTransaction> transactions = new ArrayList<>();
        for (Appointment a : appointments) {
            if (a.getStatus() != Appointment.Status.APPROVED || !a.hasChargeablePrice()) continue;
            if (a.getPaymentStatus() != Appointment.PaymentStatus.DOWN_PAYMENT_PAID
                    && a.getPaymentStatus() != Appointment.PaymentStatus.FULLY_PAID) continue;

            Instant confirmedAt = a.latestPaymentEvent(PaymentEvent.Kind.REMAINING_BALANCE)
                    .or(() -> a.latestPaymentEvent(PaymentEvent.Kind.FULL_PAYMENT))
                    .or(() -> a.latestPaymentEvent(PaymentEvent.Kind.DEPOSIT))
                    .map(PaymentEvent::getConfirmedAt)
                    .orElse(null);
            LocalDate date = confirmedAt != null ? toLocalDate(confirmedAt) : a.getDate();
            if (date.isBefore(from) || date.isAfter(to)) continue;

            PaymentTransaction.Status status = a.getPaymentStatus() == Appointment.PaymentStatus.FULLY_PAID
                    ? PaymentTransaction.Status.COMPLETED
                    : PaymentTransaction.Status.PENDING;
            transactions.add(new PaymentTransaction(transactionId(a.getId()), a.getId(), a.getOwnerName(),
                    StringUtils.defaultIfBlank(a.getServiceType(), UNSPECIFIED_SERVICE),
                    a.getPrice(), date, confirmedAt, status));
        }
        transactions.sort(Comparator.comparing(PaymentTransaction::date)
                .thenComparing(PaymentTransaction::appointmentId)
                .reversed());
        return transactions;
    }

    static String transactionId(Long appointmentId) {
        return "TXN-" + StringUtils.leftPad(String.valueOf(appointmentId), 6, '0');
    }

    private LocalDate toLocalDate(Instant instant) {
        return LocalDate.ofInstant(instant, clock.getZone());
    }

    private static String label(LocalDate start, RevenueSeries.Granularity granularity) {
        return granularity == RevenueSeries.Granularity.DAY ? start.toString() : YearMonth.from(start).toString();
    }

    private static void requirePeriod(LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            throw new ValidationException("Both 'from' and 'to' dates are required.");
        }
        if (from.isAfter(to)) {
            throw new ValidationException("Period start " + from + " is after its end " + to + ".");
        }
    }
}

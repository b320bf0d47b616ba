package com.vet.clinic.service;

import com.vet.clinic.dto.PaymentTransaction;
import com.vet.clinic.dto.RevenueSeries;
import com.vet.clinic.dto.ServiceShare;
import com.vet.clinic.entity.Appointment;
import com.vet.clinic.entity.PaymentEvent;
import com.vet.clinic.exception.ValidationException;
import com.vet.clinic.repository.AppointmentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RevenueAttributorTest {

    private AppointmentRepository appointmentRepository;
    private RevenueAttributor attributor;
    private long nextId;

    @BeforeEach
    void setUp() {
        appointmentRepository = Mockito.mock(AppointmentRepository.class);
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);
        attributor = new RevenueAttributor(appointmentRepository, clock, 60);
        nextId = 1;
    }

    @Test
    void fullyPaidAppointmentCountsInItsMonth() {
        Appointment paid = approved("1000", LocalDate.of(2024, 3, 5), "Checkup");
        paid.setPaymentStatus(Appointment.PaymentStatus.FULLY_PAID);

        RevenueSeries series = attributor.recognizedRevenue(List.of(paid),
                LocalDate.of(2024, 1, 1), LocalDate.of(2024, 6, 30));

        assertThat(series.granularity()).isEqualTo(RevenueSeries.Granularity.MONTH);
        assertThat(series.buckets()).hasSize(6);
        assertThat(series.revenueFor(LocalDate.of(2024, 3, 1))).isEqualByComparingTo("1000");
        assertThat(series.revenueFor(LocalDate.of(2024, 4, 1))).isEqualByComparingTo("0");
        assertThat(series.total()).isEqualByComparingTo("1000");
    }

    @Test
    void shortPeriodIsBucketedByDayWithEmptyDaysPresent() {
        Appointment paid = approved("1000", LocalDate.of(2024, 3, 5), "Checkup");
        paid.setPaymentStatus(Appointment.PaymentStatus.FULLY_PAID);

        RevenueSeries series = attributor.recognizedRevenue(List.of(paid),
                LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 31));

        assertThat(series.granularity()).isEqualTo(RevenueSeries.Granularity.DAY);
        assertThat(series.buckets()).hasSize(31);
        assertThat(series.revenueFor(LocalDate.of(2024, 3, 5))).isEqualByComparingTo("1000");
        assertThat(series.buckets().get(4).label()).isEqualTo("2024-03-05");
        assertThat(series.buckets().get(4).appointments()).isEqualTo(1);
        assertThat(series.buckets().get(0).revenue()).isEqualByComparingTo("0");
    }

    @Test
    void depositOnlyAppointmentContributesNothing() {
        Appointment deposit = approved("800", LocalDate.of(2024, 3, 5), "Surgery");
        deposit.setPaymentStatus(Appointment.PaymentStatus.DOWN_PAYMENT_PAID);
        deposit.appendPaymentEvent(event(PaymentEvent.Kind.DEPOSIT, "2024-03-01T10:00:00Z"));

        RevenueSeries series = attributor.recognizedRevenue(List.of(deposit),
                LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 31));

        assertThat(series.total()).isEqualByComparingTo("0");
    }

    @Test
    void onlyApprovedPricedAppointmentsAreRecognized() {
        Appointment cancelled = approved("500", LocalDate.of(2024, 3, 5), "Checkup");
        cancelled.setPaymentStatus(Appointment.PaymentStatus.FULLY_PAID);
        cancelled.setStatus(Appointment.Status.CANCELLED);
        Appointment free = approved("0", LocalDate.of(2024, 3, 5), "Checkup");
        free.setPaymentStatus(Appointment.PaymentStatus.FULLY_PAID);

        RevenueSeries series = attributor.recognizedRevenue(List.of(cancelled, free),
                LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 31));

        assertThat(series.total()).isEqualByComparingTo("0");
    }

    @Test
    void remainingBalanceDateWinsOverVisitDate() {
        Appointment a = approved("1200", LocalDate.of(2024, 3, 5), "Dental");
        a.setPaymentStatus(Appointment.PaymentStatus.FULLY_PAID);
        a.appendPaymentEvent(event(PaymentEvent.Kind.DEPOSIT, "2024-03-01T09:00:00Z"));
        a.appendPaymentEvent(event(PaymentEvent.Kind.REMAINING_BALANCE, "2024-04-02T09:00:00Z"));

        assertThat(attributor.recognitionDate(a)).isEqualTo(LocalDate.of(2024, 4, 2));

        RevenueSeries march = attributor.recognizedRevenue(List.of(a),
                LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 31));
        RevenueSeries april = attributor.recognizedRevenue(List.of(a),
                LocalDate.of(2024, 4, 1), LocalDate.of(2024, 4, 30));
        assertThat(march.total()).isEqualByComparingTo("0");
        assertThat(april.revenueFor(LocalDate.of(2024, 4, 2))).isEqualByComparingTo("1200");
    }

    @Test
    void recognitionDayFollowsClockZone() {
        Clock manila = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneId.of("Asia/Manila"));
        RevenueAttributor local = new RevenueAttributor(appointmentRepository, manila, 60);
        Appointment a = approved("500", LocalDate.of(2024, 3, 1), "Checkup");
        a.setPaymentStatus(Appointment.PaymentStatus.FULLY_PAID);
        a.appendPaymentEvent(event(PaymentEvent.Kind.FULL_PAYMENT, "2024-03-04T18:00:00Z"));

        assertThat(local.recognitionDate(a)).isEqualTo(LocalDate.of(2024, 3, 5));
        assertThat(attributor.recognitionDate(a)).isEqualTo(LocalDate.of(2024, 3, 4));
    }

    @Test
    void repeatedRunsGiveIdenticalSeries() {
        List<Appointment> ledger = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            Appointment a = approved(String.valueOf(100 * i), LocalDate.of(2024, 3, i), "Checkup");
            a.setPaymentStatus(Appointment.PaymentStatus.FULLY_PAID);
            ledger.add(a);
        }

        RevenueSeries first = attributor.recognizedRevenue(ledger, LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 10));
        RevenueSeries second = attributor.recognizedRevenue(ledger, LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 10));

        assertThat(second).isEqualTo(first);
        assertThat(first.total()).isEqualByComparingTo("1500");
    }

    @Test
    void repositoryBackedSeriesReadsApprovedAppointments() {
        Appointment paid = approved("1000", LocalDate.of(2024, 3, 5), "Checkup");
        paid.setPaymentStatus(Appointment.PaymentStatus.FULLY_PAID);
        Mockito.when(appointmentRepository.findByStatus(Appointment.Status.APPROVED)).thenReturn(List.of(paid));

        RevenueSeries series = attributor.recognizedRevenue(LocalDate.of(2024, 3, 5), LocalDate.of(2024, 3, 5));

        assertThat(series.buckets()).hasSize(1);
        assertThat(series.total()).isEqualByComparingTo("1000");
    }

    @Test
    void invertedPeriodIsRejected() {
        assertThatThrownBy(() -> attributor.recognizedRevenue(List.of(),
                LocalDate.of(2024, 3, 2), LocalDate.of(2024, 3, 1)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void serviceDistributionSharesByCount() {
        List<Appointment> ledger = new ArrayList<>();
        for (String service : List.of("Checkup", "Checkup", "Vaccination")) {
            Appointment a = approved("300", LocalDate.of(2024, 3, 5), service);
            a.setPaymentStatus(Appointment.PaymentStatus.FULLY_PAID);
            ledger.add(a);
        }
        Appointment unnamed = approved("200", LocalDate.of(2024, 3, 6), null);
        unnamed.setPaymentStatus(Appointment.PaymentStatus.FULLY_PAID);
        ledger.add(unnamed);

        List<ServiceShare> shares = attributor.serviceDistribution(ledger,
                LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 31));

        assertThat(shares).extracting(ServiceShare::serviceType)
                .containsExactly("Checkup", "Vaccination", "unspecified");
        assertThat(shares.get(0).count()).isEqualTo(2);
        assertThat(shares.get(0).revenue()).isEqualByComparingTo("600");
        assertThat(shares.get(0).percentage()).isEqualTo(50.0);
        assertThat(shares.get(2).percentage()).isEqualTo(25.0);
    }

    @Test
    void transactionsIncludeDepositsAsPendingNewestFirst() {
        Appointment deposit = approved("800", LocalDate.of(2024, 3, 20), "Surgery");
        deposit.setPaymentStatus(Appointment.PaymentStatus.DOWN_PAYMENT_PAID);
        deposit.appendPaymentEvent(event(PaymentEvent.Kind.DEPOSIT, "2024-03-10T09:00:00Z"));
        Appointment full = approved("1000", LocalDate.of(2024, 3, 5), "Checkup");
        full.setPaymentStatus(Appointment.PaymentStatus.FULLY_PAID);
        full.appendPaymentEvent(event(PaymentEvent.Kind.FULL_PAYMENT, "2024-03-05T09:00:00Z"));
        Appointment unpaid = approved("400", LocalDate.of(2024, 3, 6), "Checkup");
        unpaid.setPaymentStatus(Appointment.PaymentStatus.PENDING);

        List<PaymentTransaction> transactions = attributor.paymentTransactions(List.of(full, deposit, unpaid),
                LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 31));

        assertThat(transactions).hasSize(2);
        PaymentTransaction first = transactions.get(0);
        assertThat(first.appointmentId()).isEqualTo(deposit.getId());
        assertThat(first.status()).isEqualTo(PaymentTransaction.Status.PENDING);
        assertThat(first.amount()).isEqualByComparingTo("800");
        assertThat(first.date()).isEqualTo(LocalDate.of(2024, 3, 10));
        assertThat(transactions.get(1).status()).isEqualTo(PaymentTransaction.Status.COMPLETED);
        assertThat(transactions.get(1).transactionId()).isEqualTo("TXN-" + String.format("%06d", full.getId()));
    }

    private Appointment approved(String price, LocalDate date, String serviceType) {
        return Appointment.builder()
                .id(nextId++)
                .petName("Bantay")
                .ownerName("Ana Cruz")
                .email("ana@example.com")
                .phone("09170000000")
                .staffMember("Dr. Santos")
                .date(date)
                .time(LocalTime.of(9, 0))
                .serviceType(serviceType)
                .price(new BigDecimal(price))
                .status(Appointment.Status.APPROVED)
                .build();
    }

    private static PaymentEvent event(PaymentEvent.Kind kind, String at) {
        return PaymentEvent.builder()
                .kind(kind)
                .confirmedAt(Instant.parse(at))
                .method("gcash")
                .confirmedBy("staff@clinic")
                .build();
    }
}

package com.vet.clinic.service;

import com.vet.clinic.dto.AduEntry;
import com.vet.clinic.dto.StockStatus;
import com.vet.clinic.dto.StockoutProjection;
import com.vet.clinic.entity.Appointment;
import com.vet.clinic.entity.ConsumptionLine;
import com.vet.clinic.entity.InventoryItem;
import com.vet.clinic.exception.InsufficientDataException;
import com.vet.clinic.repository.ConsumptionLineRepository;
import com.vet.clinic.repository.InventoryItemRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;

class ConsumptionForecasterTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 1);

    private ConsumptionLineRepository lineRepository;
    private InventoryItemRepository itemRepository;
    private ConsumptionForecaster forecaster;

    @BeforeEach
    void setUp() {
        lineRepository = Mockito.mock(ConsumptionLineRepository.class);
        itemRepository = Mockito.mock(InventoryItemRepository.class);
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T08:00:00Z"), ZoneOffset.UTC);
        forecaster = new ConsumptionForecaster(lineRepository, itemRepository, clock, 1.2);
    }

    @Test
    void averageDailyUseDividesByDistinctUsageDays() {
        List<ConsumptionLine> lines = List.of(
                confirmed(LocalDate.of(2024, 5, 1), 4),
                confirmed(LocalDate.of(2024, 5, 1), 2),
                confirmed(LocalDate.of(2024, 5, 3), 3));

        assertThat(ConsumptionForecaster.averageDailyUse(lines)).isEqualTo(4.5);
    }

    @Test
    void pendingAndRejectedLinesAreNotUsage() {
        ConsumptionLine pending = confirmed(LocalDate.of(2024, 5, 2), 10);
        pending.setDeductionStatus(ConsumptionLine.DeductionStatus.PENDING);
        ConsumptionLine rejected = confirmed(LocalDate.of(2024, 5, 4), 7);
        rejected.setDeductionStatus(ConsumptionLine.DeductionStatus.REJECTED);

        assertThat(ConsumptionForecaster.averageDailyUse(List.of(pending, rejected))).isZero();
    }

    @Test
    void averageDailyUseIsZeroWithoutHistory() {
        Mockito.when(lineRepository.findWithAppointmentByItemNameAndStatus(anyString(), eq(ConsumptionLine.DeductionStatus.CONFIRMED)))
                .thenReturn(List.of());

        assertThat(forecaster.averageDailyUse("Rabies Vaccine")).isZero();
    }

    @Test
    void projectionWalksStockDownToZero() {
        InventoryItem item = item(10, 4);
        item.setLeadTime(2);
        item.setTargetLevel(50);
        item.setSafetyStock(3);

        StockoutProjection projection = forecaster.project(item, 4.0);

        assertThat(projection.daysUntilStockout()).isEqualTo(3);
        assertThat(projection.points()).extracting(StockoutProjection.Point::projectedStock)
                .containsExactly(10.0, 6.0, 2.0, 0.0);
        assertThat(projection.points().get(0).date()).isEqualTo(TODAY);
        assertThat(projection.projectedStockoutDate()).isEqualTo(TODAY.plusDays(3));
        assertThat(projection.reorderByDate()).isEqualTo(TODAY.plusDays(1));
        assertThat(projection.suggestedOrderQuantity()).isEqualTo(40);
        assertThat(projection.reorderPoint()).isEqualTo(4);
        assertThat(projection.safetyStock()).isEqualTo(3);
        assertThat(projection.status()).isEqualTo(StockStatus.SAFE);
    }

    @Test
    void projectionNeedsUsageHistory() {
        InventoryItem item = item(10, 4);

        assertThatThrownBy(() -> forecaster.project(item, 0.0))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void stockoutProjectionLoadsItemAndHistory() {
        InventoryItem item = item(9, null);
        Mockito.when(itemRepository.findById(7L)).thenReturn(Optional.of(item));
        Mockito.when(lineRepository.findWithAppointmentByItemNameAndStatus("Amoxicillin", ConsumptionLine.DeductionStatus.CONFIRMED))
                .thenReturn(List.of(confirmed(LocalDate.of(2024, 5, 1), 2), confirmed(LocalDate.of(2024, 5, 2), 2)));

        StockoutProjection projection = forecaster.stockoutProjection(7L);

        assertThat(projection.averageDailyUse()).isEqualTo(2.0);
        assertThat(projection.daysUntilStockout()).isEqualTo(5);
        assertThat(projection.points()).hasSize(6);
        assertThat(projection.points().get(5).projectedStock()).isZero();
        assertThat(projection.suggestedOrderQuantity()).isNull();
        assertThat(projection.status()).isEqualTo(StockStatus.REORDER_NOW);
    }

    @Test
    void classificationAgainstReorderPoint() {
        assertThat(forecaster.classify(item(8, 10))).isEqualTo(StockStatus.REORDER_NOW);
        assertThat(forecaster.classify(item(10, 10))).isEqualTo(StockStatus.REORDER_NOW);
        assertThat(forecaster.classify(item(11, 10))).isEqualTo(StockStatus.MONITOR);
        assertThat(forecaster.classify(item(12, 10))).isEqualTo(StockStatus.MONITOR);
        assertThat(forecaster.classify(item(20, 10))).isEqualTo(StockStatus.SAFE);
    }

    @Test
    void classificationWithoutReorderPointUsesFixedLevels() {
        assertThat(forecaster.classify(item(9, null))).isEqualTo(StockStatus.REORDER_NOW);
        assertThat(forecaster.classify(item(10, null))).isEqualTo(StockStatus.MONITOR);
        assertThat(forecaster.classify(item(20, 0))).isEqualTo(StockStatus.SAFE);
    }

    @Test
    void reportCoversEveryItemRoundedToTwoDecimals() {
        InventoryItem used = item(30, 10);
        used.setId(1L);
        used.setName("Amoxicillin");
        InventoryItem unused = item(5, null);
        unused.setId(2L);
        unused.setName("Bandage");
        Mockito.when(itemRepository.findAllByOrderByNameAsc()).thenReturn(List.of(used, unused));
        Mockito.when(lineRepository.findWithAppointmentByItemNameAndStatus("Amoxicillin", ConsumptionLine.DeductionStatus.CONFIRMED))
                .thenReturn(List.of(
                        confirmed(LocalDate.of(2024, 5, 1), 1),
                        confirmed(LocalDate.of(2024, 5, 2), 1),
                        confirmed(LocalDate.of(2024, 5, 3), 2)));
        Mockito.when(lineRepository.findWithAppointmentByItemNameAndStatus("Bandage", ConsumptionLine.DeductionStatus.CONFIRMED))
                .thenReturn(List.of());

        List<AduEntry> report = forecaster.averageDailyUseReport();

        assertThat(report).extracting(AduEntry::itemName).containsExactly("Amoxicillin", "Bandage");
        assertThat(report.get(0).averageDailyUse()).isEqualTo(1.33);
        assertThat(report.get(0).status()).isEqualTo(StockStatus.SAFE);
        assertThat(report.get(1).averageDailyUse()).isZero();
        assertThat(report.get(1).status()).isEqualTo(StockStatus.REORDER_NOW);
    }

    private static InventoryItem item(int stock, Integer reorderPoint) {
        return InventoryItem.builder()
                .id(7L)
                .name("Amoxicillin")
                .category("Medicines")
                .stock(stock)
                .reorderPoint(reorderPoint)
                .build();
    }

    private static ConsumptionLine confirmed(LocalDate visitDate, int quantity) {
        Appointment appointment = Appointment.builder().date(visitDate).build();
        return ConsumptionLine.builder()
                .appointment(appointment)
                .itemId(7L)
                .itemName("Amoxicillin")
                .quantity(quantity)
                .deductionStatus(ConsumptionLine.DeductionStatus.CONFIRMED)
                .build();
    }
}

package com.vet.clinic.config;

import com.vet.clinic.entity.AvailabilityProfile;
import com.vet.clinic.entity.InventoryItem;
import com.vet.clinic.repository.AvailabilityProfileRepository;
import com.vet.clinic.repository.InventoryItemRepository;
import com.vet.clinic.service.AvailabilityEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.List;

/**
 * Idempotent seeder: inserts demo availability profiles and inventory items when the
 * tables are empty. Safe to re-run. Enabled with {@code clinic.seed.enabled=true}.
 */
@Component
@ConditionalOnProperty(name = "clinic.seed.enabled", havingValue = "true")
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    private final AvailabilityProfileRepository profileRepository;
    private final InventoryItemRepository inventoryItemRepository;
    private final AvailabilityEngine availabilityEngine;

    public DataInitializer(AvailabilityProfileRepository profileRepository,
                           InventoryItemRepository inventoryItemRepository,
                           AvailabilityEngine availabilityEngine) {
        this.profileRepository = profileRepository;
        this.inventoryItemRepository = inventoryItemRepository;
        this.availabilityEngine = availabilityEngine;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void seed() {
        if (profileRepository.count() == 0) {
            log.info("Seeding availability profiles...");
            List<AvailabilityProfile> profiles = List.of(
                    AvailabilityProfile.builder()
                            .staffMember("Dr. Maria Santos")
                            .workingDays(EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY))
                            .startTime(LocalTime.of(9, 0)).endTime(LocalTime.of(17, 0))
                            .appointmentDuration(30).breakTime(0)
                            .lunchStart(LocalTime.of(12, 0)).lunchEnd(LocalTime.of(13, 0))
                            .build(),
                    AvailabilityProfile.builder()
                            .staffMember("Dr. Jose Reyes")
                            .workingDays(EnumSet.of(DayOfWeek.TUESDAY, DayOfWeek.THURSDAY, DayOfWeek.SATURDAY))
                            .startTime(LocalTime.of(10, 0)).endTime(LocalTime.of(18, 0))
                            .appointmentDuration(45).breakTime(15)
                            .build()
            );
            for (AvailabilityProfile p : profiles) {
                availabilityEngine.validateProfile(p);
                profileRepository.save(p);
            }
        }

        if (inventoryItemRepository.count() == 0) {
            log.info("Seeding inventory...");
            inventoryItemRepository.saveAll(List.of(
                    item("Rabies Vaccine", "Vaccines", 40, "450.00", 15, 60, 7, 5),
                    item("Amoxicillin 250mg", "Medicines", 120, "35.00", 30, 200, 5, 10),
                    item("Surgical Gloves (pair)", "Supplies", 300, "12.50", 80, 400, 3, 20),
                    item("Deworming Tablet", "Medicines", 18, "60.00", 20, 80, 7, 5)
            ));
        }
        log.info("DataInitializer: profiles={}, items={}", profileRepository.count(), inventoryItemRepository.count());
    }

    private static InventoryItem item(String name, String category, int stock, String price,
                                      int reorderPoint, int targetLevel, int leadTime, int safetyStock) {
        return InventoryItem.builder()
                .name(name)
                .category(category)
                .stock(stock)
                .price(new BigDecimal(price))
                .expiryDate(LocalDate.now().plusYears(1))
                .reorderPoint(reorderPoint)
                .targetLevel(targetLevel)
                .leadTime(leadTime)
                .safetyStock(safetyStock)
                .build();
    }
}

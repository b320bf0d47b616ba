package com.vet.clinic.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDate;

@Entity
@Table(name = "inventory_item")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InventoryItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 150)
    private String name;

    @Column(length = 100)
    private String category;

    @Column(nullable = false)
    private int stock;

    @Column(precision = 12, scale = 2)
    private BigDecimal price;

    @Column(name = "expiry_date")
    private LocalDate expiryDate;

    @Column(name = "reorder_point")
    private Integer reorderPoint;

    @Column(name = "target_level")
    private Integer targetLevel;

    /** Supplier lead time in days. */
    @Column(name = "lead_time")
    private Integer leadTime;

    @Column(name = "safety_stock")
    private Integer safetyStock;

    @Version
    private Long version;
}

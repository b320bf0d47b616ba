package com.vet.clinic.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "consumption_line", indexes = {
    @Index(name = "idx_consumption_item_status", columnList = "item_name, deduction_status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConsumptionLine {

    public enum DeductionStatus { PENDING, CONFIRMED, REJECTED }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "appointment_id", nullable = false)
    private Appointment appointment;

    @Column(name = "item_id", nullable = false)
    private Long itemId;

    /** Item name and category as they were when usage was logged. */
    @Column(name = "item_name", nullable = false, length = 150)
    private String itemName;

    @Column(name = "item_category", length = 100)
    private String itemCategory;

    @Column(nullable = false)
    private int quantity;

    @Enumerated(EnumType.STRING)
    @Column(name = "deduction_status", nullable = false, length = 20)
    @Builder.Default
    private DeductionStatus deductionStatus = DeductionStatus.PENDING;

    @Column(name = "logged_at", nullable = false)
    private Instant loggedAt;

    @Column(name = "rejected_reason", length = 500)
    private String rejectedReason;

    @Column(name = "approved_by", length = 150)
    private String approvedBy;

    @Column(name = "approved_at")
    private Instant approvedAt;

    @Version
    private Long version;

    public boolean isPending() {
        return deductionStatus == DeductionStatus.PENDING;
    }
}

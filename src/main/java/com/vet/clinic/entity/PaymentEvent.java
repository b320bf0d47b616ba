package com.vet.clinic.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One confirmed payment step. Appended to an appointment, never edited.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PaymentEvent {

    public enum Kind { DEPOSIT, FULL_PAYMENT, REMAINING_BALANCE }

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 30)
    private Kind kind;

    @Column(name = "confirmed_at", nullable = false)
    private Instant confirmedAt;

    @Column(name = "method", length = 30)
    private String method;

    @Column(name = "confirmed_by", length = 150)
    private String confirmedBy;
}

package com.vet.clinic.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ConsumptionRequest {
    @NotNull(message = "Item id is required.")
    private Long itemId;

    private int quantity;
}

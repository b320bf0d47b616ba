package com.vet.clinic.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class DeductionDecisionRequest {
    @NotNull(message = "Decision is required.")
    private DeductionDecision decision;

    private String reason;
}

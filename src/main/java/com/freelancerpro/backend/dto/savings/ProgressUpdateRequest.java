package com.freelancerpro.backend.dto.savings;

import java.math.BigDecimal;

import com.freelancerpro.backend.enums.ProgressAction;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ProgressUpdateRequest {

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    private BigDecimal amount;

    @NotNull(message = "Action is required")
    private ProgressAction action;
}

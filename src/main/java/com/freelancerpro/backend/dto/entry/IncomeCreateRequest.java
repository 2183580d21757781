package com.freelancerpro.backend.dto.entry;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

import com.freelancerpro.backend.enums.IncomeCategory;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class IncomeCreateRequest {

    @NotNull(message = "Project ID is required")
    private UUID projectId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    private BigDecimal amount;

    @NotBlank(message = "Description is required")
    @Size(min = 2, max = 200, message = "Description must be between 2 and 200 characters")
    private String description;

    // defaults to now
    private LocalDateTime date;

    private IncomeCategory category;
}

package com.freelancerpro.backend.dto.entry;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

import com.freelancerpro.backend.enums.IncomeCategory;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class IncomeUpdateRequest {

    private UUID projectId;

    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    private BigDecimal amount;

    @Size(min = 2, max = 200, message = "Description must be between 2 and 200 characters")
    private String description;

    private LocalDateTime date;

    private IncomeCategory category;
}

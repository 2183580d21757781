package com.freelancerpro.backend.dto.entry;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

import com.freelancerpro.backend.enums.ExpenseCategory;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ExpenseCreateRequest {

    @NotNull(message = "Project ID is required")
    private UUID projectId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    private BigDecimal amount;

    @NotBlank(message = "Description is required")
    @Size(min = 2, max = 200, message = "Description must be between 2 and 200 characters")
    private String description;

    private LocalDateTime date;

    private ExpenseCategory category;

    @Size(max = 500, message = "Receipt URL cannot exceed 500 characters")
    private String receiptUrl;
}

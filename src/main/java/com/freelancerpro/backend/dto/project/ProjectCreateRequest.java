package com.freelancerpro.backend.dto.project;

import java.math.BigDecimal;

import com.freelancerpro.backend.enums.ProjectStatus;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ProjectCreateRequest {

    @NotBlank(message = "Project name is required")
    @Size(min = 2, max = 100, message = "Project name must be between 2 and 100 characters")
    private String name;

    @NotBlank(message = "Client name is required")
    @Size(min = 2, max = 100, message = "Client name must be between 2 and 100 characters")
    private String clientName;

    @NotNull(message = "Expected payment is required")
    @DecimalMin(value = "0.01", message = "Expected payment must be greater than 0")
    private BigDecimal expectedPayment;

    // defaults to active
    private ProjectStatus status;

    @DecimalMin(value = "0", message = "Budget allocation must be between 0 and 100")
    @DecimalMax(value = "100", message = "Budget allocation must be between 0 and 100")
    private BigDecimal budgetAllocation;

    @Size(max = 500, message = "Description cannot exceed 500 characters")
    private String description;
}

package com.freelancerpro.backend.dto.savings;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.freelancerpro.backend.enums.GoalPriority;
import com.freelancerpro.backend.enums.GoalType;
import com.freelancerpro.backend.enums.SavingsCategory;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class SavingsGoalCreateRequest {

    @NotBlank(message = "Goal title is required")
    @Size(min = 2, max = 100, message = "Title must be between 2 and 100 characters")
    private String title;

    @NotNull(message = "Target amount is required")
    @DecimalMin(value = "1", message = "Target amount must be at least 1")
    private BigDecimal targetAmount;

    @DecimalMin(value = "0", message = "Current amount cannot be negative")
    private BigDecimal currentAmount;

    // must be in the future, checked against the service clock
    @NotNull(message = "Deadline is required")
    private LocalDateTime deadline;

    @Size(max = 500, message = "Description cannot exceed 500 characters")
    private String description;

    private SavingsCategory category;

    private GoalPriority priority;

    private GoalType type;
}

package com.freelancerpro.backend.dto.savings;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.freelancerpro.backend.enums.GoalPriority;
import com.freelancerpro.backend.enums.GoalType;
import com.freelancerpro.backend.enums.SavingsCategory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SavingsGoalResponseDTO {
    private String id;
    private String title;
    private BigDecimal targetAmount;
    private BigDecimal currentAmount;
    private LocalDateTime deadline;
    private String description;
    private SavingsCategory category;
    private GoalPriority priority;
    private GoalType type;

    @JsonProperty("isCompleted")
    private boolean completed;

    private BigDecimal progressPercentage;
    private BigDecimal remainingAmount;
    private long daysRemaining;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}

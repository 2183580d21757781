package com.freelancerpro.backend.dto.stats;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SavingsStatsDTO {
    private long totalGoals;
    private long activeGoals;
    private long completedGoals;
    private long expiringSoonCount;
    private BigDecimal totalTargetAmount;
    private BigDecimal totalCurrentAmount;
    // percentage of all targets reached, 2 decimals
    private BigDecimal totalProgress;
}

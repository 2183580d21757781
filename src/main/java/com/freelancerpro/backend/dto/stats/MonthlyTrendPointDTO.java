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
public class MonthlyTrendPointDTO {
    // YYYY-MM
    private String month;
    private BigDecimal amount;
    private long count;
}

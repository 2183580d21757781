package com.freelancerpro.backend.dto.stats;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntryStatsDTO {
    private BigDecimal total;
    private long count;
    private BigDecimal average;
    private Map<String, BigDecimal> byCategory;
    private List<MonthlyTrendPointDTO> monthlyTrend;
}

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
public class ProjectBreakdownDTO {
    private String projectId;
    private String projectName;
    private String clientName;
    private BigDecimal totalAmount;
    private long entryCount;
}

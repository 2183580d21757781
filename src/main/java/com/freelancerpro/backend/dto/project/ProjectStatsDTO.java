package com.freelancerpro.backend.dto.project;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectStatsDTO {
    private long totalProjects;
    private long activeProjects;
    private long completedProjects;
    private long onHoldProjects;
    private BigDecimal totalExpectedPayment;
    private BigDecimal averageExpectedPayment;
}

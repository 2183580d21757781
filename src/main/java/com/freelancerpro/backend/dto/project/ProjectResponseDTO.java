package com.freelancerpro.backend.dto.project;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.freelancerpro.backend.enums.ProjectStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectResponseDTO {
    private String id;
    private String name;
    private String clientName;
    private BigDecimal expectedPayment;
    private ProjectStatus status;
    private BigDecimal budgetAllocation;
    private String description;
    private LocalDateTime createdDate;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}

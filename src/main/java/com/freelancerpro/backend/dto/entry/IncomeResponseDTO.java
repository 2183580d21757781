package com.freelancerpro.backend.dto.entry;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.freelancerpro.backend.dto.project.ProjectRefDTO;
import com.freelancerpro.backend.enums.IncomeCategory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncomeResponseDTO {
    private String id;
    private String projectId;
    // null when the project is gone or soft-deleted
    private ProjectRefDTO project;
    private BigDecimal amount;
    private String description;
    private LocalDateTime date;
    private IncomeCategory category;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}

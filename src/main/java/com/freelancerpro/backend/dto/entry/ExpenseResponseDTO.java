package com.freelancerpro.backend.dto.entry;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.freelancerpro.backend.dto.project.ProjectRefDTO;
import com.freelancerpro.backend.enums.ExpenseCategory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExpenseResponseDTO {
    private String id;
    private String projectId;
    private ProjectRefDTO project;
    private BigDecimal amount;
    private String description;
    private LocalDateTime date;
    private ExpenseCategory category;
    private String receiptUrl;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}

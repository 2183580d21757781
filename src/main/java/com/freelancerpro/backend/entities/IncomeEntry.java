package com.freelancerpro.backend.entities;

import com.freelancerpro.backend.enums.IncomeCategory;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(
        name = "income_entries",
        indexes = {
                @Index(name = "idx_income_user_active_date", columnList = "user_id, is_active, entry_date"),
                @Index(name = "idx_income_user_project", columnList = "user_id, project_id")
        }
)
@Getter
@Setter
@NoArgsConstructor
public class IncomeEntry extends FinancialEntry {

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private IncomeCategory category = IncomeCategory.PROJECT_PAYMENT;
}

package com.freelancerpro.backend.entities;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.freelancerpro.backend.enums.ProjectStatus;

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
        name = "projects",
        indexes = {
                @Index(name = "idx_project_user_active_status", columnList = "user_id, is_active, status")
        }
)
@Getter
@Setter
@NoArgsConstructor
public class Project extends OwnedRecord {

    public static final String STATUS = "status";

    @Column(nullable = false, length = 100)
    private String name;

    @Column(name = "client_name", nullable = false, length = 100)
    private String clientName;

    @Column(name = "expected_payment", nullable = false, precision = 19, scale = 2)
    private BigDecimal expectedPayment;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ProjectStatus status = ProjectStatus.ACTIVE;

    /** Share of the payment reserved for expenses, 0-100. */
    @Column(name = "budget_allocation", nullable = false, precision = 5, scale = 2)
    private BigDecimal budgetAllocation = new BigDecimal("10");

    @Column(length = 500)
    private String description;

    @Column(name = "created_date", nullable = false)
    private LocalDateTime createdDate;
}

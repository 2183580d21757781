package com.freelancerpro.backend.entities;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import lombok.Getter;
import lombok.Setter;

@MappedSuperclass
@Getter
@Setter
public abstract class FinancialEntry extends OwnedRecord {

    public static final String PROJECT_ID = "projectId";
    public static final String DATE = "date";
    public static final String CATEGORY = "category";

    // checked against the owner's projects on write only
    @Column(name = "project_id", nullable = false)
    private UUID projectId;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 200)
    private String description;

    @Column(name = "entry_date", nullable = false)
    private LocalDateTime date;
}

package com.freelancerpro.backend.services.aggregation;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

import com.freelancerpro.backend.entities.ExpenseEntry;
import com.freelancerpro.backend.entities.IncomeEntry;

/**
 * The slice of an income or expense entry that the aggregations look at.
 */
public record EntryFact(UUID projectId, String category, BigDecimal amount, LocalDateTime date) {

    public static EntryFact of(IncomeEntry entry) {
        return new EntryFact(entry.getProjectId(), entry.getCategory().getValue(), entry.getAmount(), entry.getDate());
    }

    public static EntryFact of(ExpenseEntry entry) {
        return new EntryFact(entry.getProjectId(), entry.getCategory().getValue(), entry.getAmount(), entry.getDate());
    }
}

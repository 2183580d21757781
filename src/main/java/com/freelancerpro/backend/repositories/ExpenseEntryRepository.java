package com.freelancerpro.backend.repositories;

import com.freelancerpro.backend.entities.ExpenseEntry;

public interface ExpenseEntryRepository extends OwnedRecordRepository<ExpenseEntry> {
}

package com.freelancerpro.backend.repositories;

import com.freelancerpro.backend.entities.IncomeEntry;

public interface IncomeEntryRepository extends OwnedRecordRepository<IncomeEntry> {
}

package com.freelancerpro.backend.repositories;

import com.freelancerpro.backend.entities.SavingsGoal;

public interface SavingsGoalRepository extends OwnedRecordRepository<SavingsGoal> {
}

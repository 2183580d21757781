package com.freelancerpro.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.freelancerpro.backend.entities.ExpenseEntry;
import com.freelancerpro.backend.entities.IncomeEntry;
import com.freelancerpro.backend.entities.Project;
import com.freelancerpro.backend.entities.SavingsGoal;
import com.freelancerpro.backend.repositories.ExpenseEntryRepository;
import com.freelancerpro.backend.repositories.IncomeEntryRepository;
import com.freelancerpro.backend.repositories.ProjectRepository;
import com.freelancerpro.backend.repositories.SavingsGoalRepository;
import com.freelancerpro.backend.services.query.ScopedRecordStore;

/**
 * One owner-scoped store per record table. Services depend on these, never on the
 * repositories.
 */
@Configuration
public class RecordStoreConfig {

    @Bean
    public ScopedRecordStore<Project> projectStore(ProjectRepository repository) {
        return new ScopedRecordStore<>(repository, Project.class, "Project");
    }

    @Bean
    public ScopedRecordStore<IncomeEntry> incomeStore(IncomeEntryRepository repository) {
        return new ScopedRecordStore<>(repository, IncomeEntry.class, "Income entry");
    }

    @Bean
    public ScopedRecordStore<ExpenseEntry> expenseStore(ExpenseEntryRepository repository) {
        return new ScopedRecordStore<>(repository, ExpenseEntry.class, "Expense entry");
    }

    @Bean
    public ScopedRecordStore<SavingsGoal> savingsGoalStore(SavingsGoalRepository repository) {
        return new ScopedRecordStore<>(repository, SavingsGoal.class, "Savings goal");
    }
}

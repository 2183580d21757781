package com.freelancerpro.backend.services.query;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.domain.Specification;

import com.freelancerpro.backend.entities.ExpenseEntry;
import com.freelancerpro.backend.entities.FinancialEntry;
import com.freelancerpro.backend.entities.IncomeEntry;
import com.freelancerpro.backend.entities.OwnedRecord;
import com.freelancerpro.backend.entities.Project;
import com.freelancerpro.backend.entities.SavingsGoal;
import com.freelancerpro.backend.enums.ExpenseCategory;
import com.freelancerpro.backend.enums.GoalPriority;
import com.freelancerpro.backend.enums.GoalState;
import com.freelancerpro.backend.enums.IncomeCategory;
import com.freelancerpro.backend.enums.ProjectStatus;
import com.freelancerpro.backend.enums.SavingsCategory;

import lombok.extern.slf4j.Slf4j;

/**
 * Query builders for each record type.
 *
 * <p>Filter values that do not name a known enum constant are ignored rather than
 * rejected. A {@code projectId} that is not a UUID cannot match any entry, so it
 * produces an empty result.
 */
@Slf4j
public final class RecordQueries {

    private static final RecordQueryBuilder<Project> PROJECTS =
            new RecordQueryBuilder<>(null, RecordQueries::projectFilters);

    private static final RecordQueryBuilder<IncomeEntry> INCOME =
            new RecordQueryBuilder<>(FinancialEntry.DATE,
                    filters -> entryFilters(filters, IncomeCategory.find(filters.category()).orElse(null)));

    private static final RecordQueryBuilder<ExpenseEntry> EXPENSES =
            new RecordQueryBuilder<>(FinancialEntry.DATE,
                    filters -> entryFilters(filters, ExpenseCategory.find(filters.category()).orElse(null)));

    private static final RecordQueryBuilder<SavingsGoal> SAVINGS =
            new RecordQueryBuilder<>(null, RecordQueries::savingsFilters);

    private RecordQueries() {
    }

    public static RecordQueryBuilder<Project> projects() {
        return PROJECTS;
    }

    public static RecordQueryBuilder<IncomeEntry> incomeEntries() {
        return INCOME;
    }

    public static RecordQueryBuilder<ExpenseEntry> expenseEntries() {
        return EXPENSES;
    }

    public static RecordQueryBuilder<SavingsGoal> savingsGoals() {
        return SAVINGS;
    }

    public static Specification<SavingsGoal> inState(GoalState state) {
        return OwnedRecordSpecifications.attributeEquals(SavingsGoal.COMPLETED, state.completedFlag());
    }

    public static Specification<SavingsGoal> openWithDeadlineBy(LocalDateTime cutoff) {
        return Specification.where(inState(GoalState.ACTIVE))
                .and(OwnedRecordSpecifications.onOrBefore(SavingsGoal.DEADLINE, cutoff));
    }

    public static <T extends FinancialEntry> Specification<T> forProject(UUID projectId) {
        return OwnedRecordSpecifications.attributeEquals(FinancialEntry.PROJECT_ID, projectId);
    }

    private static Specification<Project> projectFilters(RecordFilters filters) {
        Optional<ProjectStatus> status = ProjectStatus.find(filters.status());
        ignoredIfUnknown("status", filters.status(), status);
        return status.<Specification<Project>>map(s -> OwnedRecordSpecifications.attributeEquals(Project.STATUS, s))
                .orElse(null);
    }

    private static <T extends FinancialEntry> Specification<T> entryFilters(RecordFilters filters, Enum<?> category) {
        Specification<T> spec = null;
        if (hasText(filters.projectId())) {
            spec = and(spec, projectIdMatching(filters.projectId()));
        }
        ignoredIfUnknown("category", filters.category(), Optional.ofNullable(category));
        if (category != null) {
            spec = and(spec, OwnedRecordSpecifications.attributeEquals(FinancialEntry.CATEGORY, category));
        }
        return spec;
    }

    private static Specification<SavingsGoal> savingsFilters(RecordFilters filters) {
        Specification<SavingsGoal> spec = null;

        Optional<GoalState> state = GoalState.find(filters.status());
        ignoredIfUnknown("status", filters.status(), state);
        if (state.isPresent()) {
            spec = and(spec, inState(state.get()));
        }

        Optional<SavingsCategory> category = SavingsCategory.find(filters.category());
        ignoredIfUnknown("category", filters.category(), category);
        if (category.isPresent()) {
            spec = and(spec, OwnedRecordSpecifications.attributeEquals(SavingsGoal.CATEGORY, category.get()));
        }

        Optional<GoalPriority> priority = GoalPriority.find(filters.priority());
        ignoredIfUnknown("priority", filters.priority(), priority);
        if (priority.isPresent()) {
            spec = and(spec, OwnedRecordSpecifications.attributeEquals(SavingsGoal.PRIORITY, priority.get()));
        }
        return spec;
    }

    private static <T extends FinancialEntry> Specification<T> projectIdMatching(String raw) {
        try {
            return forProject(UUID.fromString(raw.trim()));
        } catch (IllegalArgumentException e) {
            log.debug("projectId filter '{}' is not a valid id, result will be empty", raw);
            return OwnedRecordSpecifications.matchesNothing();
        }
    }

    private static <T extends OwnedRecord> Specification<T> and(Specification<T> left, Specification<T> right) {
        return left == null ? right : left.and(right);
    }

    private static void ignoredIfUnknown(String name, String raw, Optional<?> parsed) {
        if (hasText(raw) && parsed.isEmpty()) {
            log.debug("Ignoring unrecognised {} filter value '{}'", name, raw);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

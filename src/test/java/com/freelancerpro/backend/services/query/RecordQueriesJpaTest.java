package com.freelancerpro.backend.services.query;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import com.freelancerpro.backend.entities.IncomeEntry;
import com.freelancerpro.backend.entities.SavingsGoal;
import com.freelancerpro.backend.enums.GoalPriority;
import com.freelancerpro.backend.enums.IncomeCategory;
import com.freelancerpro.backend.repositories.IncomeEntryRepository;
import com.freelancerpro.backend.repositories.SavingsGoalRepository;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class RecordQueriesJpaTest {

    @Autowired
    private IncomeEntryRepository incomeRepository;

    @Autowired
    private SavingsGoalRepository savingsGoalRepository;

    private ScopedRecordStore<IncomeEntry> incomeStore;
    private ScopedRecordStore<SavingsGoal> goalStore;

    private final UUID owner = UUID.randomUUID();
    private final UUID stranger = UUID.randomUUID();
    private final UUID projectId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        incomeStore = new ScopedRecordStore<>(incomeRepository, IncomeEntry.class, "Income entry");
        goalStore = new ScopedRecordStore<>(savingsGoalRepository, SavingsGoal.class, "Savings goal");
    }

    private IncomeEntry income(UUID userId, String amount, LocalDateTime date, IncomeCategory category) {
        IncomeEntry entry = new IncomeEntry();
        entry.setUserId(userId);
        entry.setProjectId(projectId);
        entry.setAmount(new BigDecimal(amount));
        entry.setDescription("Invoice");
        entry.setDate(date);
        entry.setCategory(category);
        return incomeRepository.save(entry);
    }

    private SavingsGoal goal(String current, String target, LocalDateTime deadline, boolean completed) {
        SavingsGoal goal = new SavingsGoal();
        goal.setUserId(owner);
        goal.setTitle("Goal");
        goal.setCurrentAmount(new BigDecimal(current));
        goal.setTargetAmount(new BigDecimal(target));
        goal.setDeadline(deadline);
        goal.setPriority(GoalPriority.HIGH);
        goal.setCompleted(completed);
        return savingsGoalRepository.save(goal);
    }

    @Test
    void endDateIncludesTheWholeLastDay() {
        income(owner, "10", LocalDateTime.of(2024, 1, 31, 23, 0), IncomeCategory.BONUS);
        income(owner, "20", LocalDateTime.of(2024, 2, 1, 0, 0, 1), IncomeCategory.BONUS);
        income(owner, "30", LocalDateTime.of(2023, 12, 31, 23, 59, 59), IncomeCategory.BONUS);

        ScopedQuery<IncomeEntry> query = RecordQueries.incomeEntries().build(owner, RecordFilters.none(),
                new DateRange(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31)));

        assertThat(incomeStore.findAll(query))
                .extracting(IncomeEntry::getAmount)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("10"));
    }

    @Test
    void otherUsersAndSoftDeletedRecordsAreNeverReturned() {
        IncomeEntry mine = income(owner, "10", LocalDateTime.of(2024, 1, 5, 10, 0), IncomeCategory.BONUS);
        IncomeEntry deleted = income(owner, "20", LocalDateTime.of(2024, 1, 6, 10, 0), IncomeCategory.BONUS);
        IncomeEntry theirs = income(stranger, "30", LocalDateTime.of(2024, 1, 7, 10, 0), IncomeCategory.BONUS);
        incomeStore.softDelete(deleted);

        List<IncomeEntry> visible = incomeStore.findAll(RecordQueries.incomeEntries().build(owner));

        assertThat(visible).extracting(IncomeEntry::getId).containsExactly(mine.getId());
        assertThat(incomeStore.findOwned(owner, deleted.getId())).isEmpty();
        assertThat(incomeStore.findOwned(owner, theirs.getId())).isEmpty();
        assertThat(incomeStore.findIncludingInactive(deleted.getId())).isPresent();
    }

    @Test
    void unknownCategoryIsIgnoredAndKnownCategoryFilters() {
        income(owner, "10", LocalDateTime.of(2024, 1, 5, 10, 0), IncomeCategory.BONUS);
        income(owner, "20", LocalDateTime.of(2024, 1, 6, 10, 0), IncomeCategory.PROJECT_PAYMENT);

        long unfiltered = incomeStore.count(RecordQueries.incomeEntries()
                .build(owner, RecordFilters.forEntries(null, "lottery")));
        long bonusOnly = incomeStore.count(RecordQueries.incomeEntries()
                .build(owner, RecordFilters.forEntries(null, "bonus")));

        assertThat(unfiltered).isEqualTo(2);
        assertThat(bonusOnly).isEqualTo(1);
    }

    @Test
    void projectIdFilterMatchesExactlyAndMalformedIdMatchesNothing() {
        income(owner, "10", LocalDateTime.of(2024, 1, 5, 10, 0), IncomeCategory.BONUS);

        assertThat(incomeStore.count(RecordQueries.incomeEntries()
                .build(owner, RecordFilters.forEntries(projectId.toString(), null)))).isEqualTo(1);
        assertThat(incomeStore.count(RecordQueries.incomeEntries()
                .build(owner, RecordFilters.forEntries(UUID.randomUUID().toString(), null)))).isZero();
        assertThat(incomeStore.count(RecordQueries.incomeEntries()
                .build(owner, RecordFilters.forEntries("abc", null)))).isZero();
    }

    @Test
    void pageBeyondLastPageIsEmptyButKeepsTotal() {
        income(owner, "10", LocalDateTime.of(2024, 1, 5, 10, 0), IncomeCategory.BONUS);
        income(owner, "20", LocalDateTime.of(2024, 1, 6, 10, 0), IncomeCategory.BONUS);

        PageSlice<IncomeEntry> slice = incomeStore.page(
                RecordQueries.incomeEntries().build(owner), PageQuery.of(5, 1, null, null));

        assertThat(slice.records()).isEmpty();
        assertThat(slice.total()).isEqualTo(2);
    }

    @Test
    void pageFarPastIntOffsetRangeIsEmptyButKeepsTotal() {
        income(owner, "10", LocalDateTime.of(2024, 1, 5, 10, 0), IncomeCategory.BONUS);

        PageSlice<IncomeEntry> slice = incomeStore.page(
                RecordQueries.incomeEntries().build(owner), PageQuery.of(21_474_838, 100, null, null));

        assertThat(slice.records()).isEmpty();
        assertThat(slice.total()).isEqualTo(1);
    }

    @Test
    void savingsStatusFilterAndExpiringWindow() {
        LocalDateTime now = LocalDateTime.of(2024, 6, 1, 12, 0);
        goal("10", "100", now.plusDays(3), false);
        goal("10", "100", now.plusDays(30), false);
        goal("100", "100", now.plusDays(2), true);

        long active = goalStore.count(RecordQueries.savingsGoals().build(owner, new RecordFilters(null, null, "active", null)));
        long completed = goalStore.count(RecordQueries.savingsGoals().build(owner, new RecordFilters(null, null, "completed", null)));
        long highPriority = goalStore.count(RecordQueries.savingsGoals().build(owner, new RecordFilters(null, null, "bogus", "high")));
        long expiring = goalStore.count(RecordQueries.savingsGoals().build(owner)
                .and(RecordQueries.openWithDeadlineBy(now.plusDays(7))));

        assertThat(active).isEqualTo(2);
        assertThat(completed).isEqualTo(1);
        assertThat(highPriority).isEqualTo(3);
        assertThat(expiring).isEqualTo(1);
    }
}

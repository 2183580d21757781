package com.freelancerpro.backend.services;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.freelancerpro.backend.dto.user.UserProfileDTO;
import com.freelancerpro.backend.entities.SavingsGoal;
import com.freelancerpro.backend.entities.User;
import com.freelancerpro.backend.enums.Currency;
import com.freelancerpro.backend.exceptions.ConflictException;
import com.freelancerpro.backend.exceptions.ResourceNotFoundException;
import com.freelancerpro.backend.repositories.UserRepository;
import com.freelancerpro.backend.services.aggregation.EntryFact;
import com.freelancerpro.backend.services.query.DateRange;
import com.freelancerpro.backend.services.query.RecordQueries;
import com.freelancerpro.backend.services.query.ScopedRecordStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * User profile and the cumulative income / savings totals.
 *
 * <p>The profile always reports totals computed from the live records. The columns
 * on {@link User} are only written by {@link #recomputeTotals(UUID)}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;
    private final IncomeService incomeService;
    private final ScopedRecordStore<SavingsGoal> savingsGoalStore;

    @Transactional(readOnly = true)
    public UserProfileDTO getProfile(UUID userId) {
        User user = findById(userId);
        Totals totals = computeTotals(userId);
        return UserProfileDTO.builder()
                .id(user.getId().toString())
                .name(user.getName())
                .email(user.getEmail())
                .currency(user.getCurrency())
                .totalIncome(totals.income())
                .totalSavings(totals.savings())
                .netWorth(totals.income().add(totals.savings()))
                .createdAt(user.getCreatedAt())
                .build();
    }

    @Transactional
    public User createUser(String name, String email, Currency currency) {
        String normalizedEmail = email.trim().toLowerCase();
        if (userRepository.existsByEmail(normalizedEmail)) {
            throw new ConflictException("User already exists with this email");
        }
        User user = new User();
        user.setName(name.trim());
        user.setEmail(normalizedEmail);
        user.setCurrency(currency != null ? currency : Currency.USD);

        User saved = userRepository.save(user);
        log.info("Created user {}", saved.getId());
        return saved;
    }

    /**
     * Writes the current live totals into the user row.
     */
    @Transactional
    public User recomputeTotals(UUID userId) {
        User user = findById(userId);
        Totals totals = computeTotals(userId);
        user.setTotalIncome(totals.income());
        user.setTotalSavings(totals.savings());
        User saved = userRepository.save(user);
        log.info("Recomputed totals for user {}: income={}, savings={}", userId, totals.income(), totals.savings());
        return saved;
    }

    public User findById(UUID userId) {
        return userRepository.findById(userId)
                .filter(User::isActive)
                .orElseThrow(() -> new ResourceNotFoundException("User not found"));
    }

    private Totals computeTotals(UUID userId) {
        BigDecimal income = incomeService.facts(userId, DateRange.unbounded()).stream()
                .map(EntryFact::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal savings = savingsGoalStore.findAll(RecordQueries.savingsGoals().build(userId)).stream()
                .map(SavingsGoal::getCurrentAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return new Totals(money(income), money(savings));
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    private record Totals(BigDecimal income, BigDecimal savings) {
    }
}

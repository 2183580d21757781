package com.freelancerpro.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.freelancerpro.backend.dto.user.UserProfileDTO;
import com.freelancerpro.backend.entities.SavingsGoal;
import com.freelancerpro.backend.entities.User;
import com.freelancerpro.backend.enums.Currency;
import com.freelancerpro.backend.exceptions.ConflictException;
import com.freelancerpro.backend.exceptions.ResourceNotFoundException;
import com.freelancerpro.backend.repositories.UserRepository;
import com.freelancerpro.backend.services.aggregation.EntryFact;
import com.freelancerpro.backend.services.query.DateRange;
import com.freelancerpro.backend.services.query.ScopedQuery;
import com.freelancerpro.backend.services.query.ScopedRecordStore;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private IncomeService incomeService;

    @Mock
    private ScopedRecordStore<SavingsGoal> savingsGoalStore;

    @InjectMocks
    private UserService userService;

    private static User user(UUID id) {
        User user = new User();
        user.setId(id);
        user.setName("Mike Chen");
        user.setEmail("mike@example.com");
        user.setCurrency(Currency.USD);
        user.setActive(true);
        return user;
    }

    @Test
    @SuppressWarnings("unchecked")
    void getProfile_reportsLiveTotalsAndNetWorth() {
        UUID userId = UUID.randomUUID();
        when(userRepository.findById(userId)).thenReturn(Optional.of(user(userId)));
        LocalDateTime date = LocalDateTime.of(2024, 1, 5, 0, 0);
        when(incomeService.facts(userId, DateRange.unbounded())).thenReturn(List.of(
                new EntryFact(UUID.randomUUID(), "project-payment", new BigDecimal("1200.00"), date),
                new EntryFact(UUID.randomUUID(), "bonus", new BigDecimal("300.25"), date)));
        SavingsGoal goal = new SavingsGoal();
        goal.setCurrentAmount(new BigDecimal("450"));
        when(savingsGoalStore.findAll(any(ScopedQuery.class))).thenReturn(List.of(goal));

        UserProfileDTO profile = userService.getProfile(userId);

        assertEquals(new BigDecimal("1500.25"), profile.getTotalIncome());
        assertEquals(new BigDecimal("450.00"), profile.getTotalSavings());
        assertEquals(new BigDecimal("1950.25"), profile.getNetWorth());
    }

    @Test
    void createUser_duplicateEmail_isConflict() {
        when(userRepository.existsByEmail("mike@example.com")).thenReturn(true);

        assertThrows(ConflictException.class,
                () -> userService.createUser("Mike", " Mike@Example.com ", null));
        verify(userRepository, never()).save(any());
    }

    @Test
    void createUser_normalizesEmailAndDefaultsCurrency() {
        when(userRepository.existsByEmail("mike@example.com")).thenReturn(false);
        when(userRepository.save(any(User.class))).thenAnswer(inv -> inv.getArgument(0));

        User created = userService.createUser(" Mike Chen ", "Mike@Example.com", null);

        assertEquals("mike@example.com", created.getEmail());
        assertEquals("Mike Chen", created.getName());
        assertEquals(Currency.USD, created.getCurrency());
    }

    @Test
    void findById_inactiveUser_isNotFound() {
        UUID userId = UUID.randomUUID();
        User inactive = user(userId);
        inactive.setActive(false);
        when(userRepository.findById(userId)).thenReturn(Optional.of(inactive));

        assertThrows(ResourceNotFoundException.class, () -> userService.findById(userId));
    }
}

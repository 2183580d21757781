package com.freelancerpro.backend.services;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.freelancerpro.backend.config.FreelancerProperties;
import com.freelancerpro.backend.dto.PagedResult;
import com.freelancerpro.backend.dto.savings.ProgressUpdateRequest;
import com.freelancerpro.backend.dto.savings.SavingsGoalCreateRequest;
import com.freelancerpro.backend.dto.savings.SavingsGoalResponseDTO;
import com.freelancerpro.backend.dto.savings.SavingsGoalUpdateRequest;
import com.freelancerpro.backend.dto.stats.SavingsStatsDTO;
import com.freelancerpro.backend.entities.SavingsGoal;
import com.freelancerpro.backend.enums.GoalPriority;
import com.freelancerpro.backend.enums.GoalState;
import com.freelancerpro.backend.enums.GoalType;
import com.freelancerpro.backend.enums.SavingsCategory;
import com.freelancerpro.backend.exceptions.BadRequestException;
import com.freelancerpro.backend.services.pagination.PaginationEngine;
import com.freelancerpro.backend.services.query.PageQuery;
import com.freelancerpro.backend.services.query.PageSlice;
import com.freelancerpro.backend.services.query.RecordFilters;
import com.freelancerpro.backend.services.query.RecordQueries;
import com.freelancerpro.backend.services.query.ScopedQuery;
import com.freelancerpro.backend.services.query.ScopedRecordStore;
import com.freelancerpro.backend.services.savings.SavingsProgressEngine;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class SavingsGoalService {

    public static final int MIN_EXPIRING_DAYS = 1;
    public static final int MAX_EXPIRING_DAYS = 365;

    private static final int MONEY_SCALE = 2;
    private static final Sort BY_DEADLINE = Sort.by(Sort.Direction.ASC, SavingsGoal.DEADLINE);
    private static final Sort RECENTLY_UPDATED = Sort.by(Sort.Direction.DESC, SavingsGoal.UPDATED_AT);

    private final ScopedRecordStore<SavingsGoal> savingsGoalStore;
    private final FreelancerProperties properties;
    private final Clock clock;

    @Transactional(readOnly = true)
    public PagedResult<SavingsGoalResponseDTO> list(UUID userId, RecordFilters filters, PageQuery pageQuery) {
        ScopedQuery<SavingsGoal> query = RecordQueries.savingsGoals().build(userId, filters);
        LocalDateTime now = LocalDateTime.now(clock);
        PageSlice<SavingsGoal> slice = savingsGoalStore.page(query, pageQuery);
        log.info("Retrieved {} savings goals for user {}", slice.records().size(), userId);
        return PaginationEngine.toResult(slice, pageQuery, goal -> toDTO(goal, now));
    }

    @Transactional(readOnly = true)
    public List<SavingsGoalResponseDTO> listActive(UUID userId) {
        return inState(userId, GoalState.ACTIVE, BY_DEADLINE);
    }

    @Transactional(readOnly = true)
    public List<SavingsGoalResponseDTO> listCompleted(UUID userId) {
        return inState(userId, GoalState.COMPLETED, RECENTLY_UPDATED);
    }

    /**
     * Open goals whose deadline falls within the next {@code days} days, including
     * those already overdue.
     */
    @Transactional(readOnly = true)
    public List<SavingsGoalResponseDTO> listExpiringSoon(UUID userId, int days) {
        if (days < MIN_EXPIRING_DAYS || days > MAX_EXPIRING_DAYS) {
            throw new BadRequestException("Days must be between " + MIN_EXPIRING_DAYS + " and " + MAX_EXPIRING_DAYS);
        }
        LocalDateTime now = LocalDateTime.now(clock);
        return savingsGoalStore.findAll(expiringQuery(userId, now, days), BY_DEADLINE).stream()
                .map(goal -> toDTO(goal, now))
                .toList();
    }

    @Transactional(readOnly = true)
    public SavingsGoalResponseDTO get(UUID userId, String id) {
        return toDTO(savingsGoalStore.requireOwned(userId, id), LocalDateTime.now(clock));
    }

    @Transactional
    public SavingsGoalResponseDTO create(UUID userId, SavingsGoalCreateRequest request) {
        LocalDateTime now = LocalDateTime.now(clock);
        requireFutureDeadline(request.getDeadline(), now);

        SavingsGoal goal = new SavingsGoal();
        goal.setUserId(userId);
        goal.setTitle(request.getTitle().trim());
        goal.setTargetAmount(request.getTargetAmount());
        goal.setCurrentAmount(request.getCurrentAmount() != null ? request.getCurrentAmount() : BigDecimal.ZERO);
        goal.setDeadline(request.getDeadline());
        goal.setDescription(ProjectService.trimToNull(request.getDescription()));
        goal.setCategory(request.getCategory() != null ? request.getCategory() : SavingsCategory.OTHER);
        goal.setPriority(request.getPriority() != null ? request.getPriority() : GoalPriority.MEDIUM);
        goal.setType(request.getType() != null ? request.getType() : GoalType.MONTHLY);

        SavingsGoal saved = persist(goal);
        log.info("Created savings goal {} for user {}", saved.getId(), userId);
        return toDTO(saved, now);
    }

    @Transactional
    public SavingsGoalResponseDTO update(UUID userId, String id, SavingsGoalUpdateRequest request) {
        LocalDateTime now = LocalDateTime.now(clock);
        SavingsGoal goal = savingsGoalStore.requireOwned(userId, id);

        if (request.getTitle() != null) {
            goal.setTitle(ProjectService.requireText(request.getTitle(), "Title"));
        }
        if (request.getTargetAmount() != null) {
            goal.setTargetAmount(request.getTargetAmount());
        }
        if (request.getCurrentAmount() != null) {
            goal.setCurrentAmount(request.getCurrentAmount());
        }
        if (request.getDeadline() != null) {
            requireFutureDeadline(request.getDeadline(), now);
            goal.setDeadline(request.getDeadline());
        }
        if (request.getDescription() != null) {
            goal.setDescription(ProjectService.trimToNull(request.getDescription()));
        }
        if (request.getCategory() != null) {
            goal.setCategory(request.getCategory());
        }
        if (request.getPriority() != null) {
            goal.setPriority(request.getPriority());
        }
        if (request.getType() != null) {
            goal.setType(request.getType());
        }

        SavingsGoal saved = persist(goal);
        log.info("Updated savings goal {} for user {}", saved.getId(), userId);
        return toDTO(saved, now);
    }

    @Transactional
    public SavingsGoalResponseDTO updateProgress(UUID userId, String id, ProgressUpdateRequest request) {
        SavingsGoal goal = savingsGoalStore.requireOwned(userId, id);
        SavingsProgressEngine.apply(goal, request.getAction(), request.getAmount());

        SavingsGoal saved = persist(goal);
        log.info("Updated progress for savings goal {} for user {}. Action: {}, Amount: {}",
                saved.getId(), userId, request.getAction().getValue(), request.getAmount());
        return toDTO(saved, LocalDateTime.now(clock));
    }

    @Transactional
    public SavingsGoalResponseDTO markCompleted(UUID userId, String id) {
        SavingsGoal goal = savingsGoalStore.requireOwned(userId, id);
        SavingsGoal saved = persist(SavingsProgressEngine.markCompleted(goal));
        log.info("Marked savings goal {} completed for user {}", saved.getId(), userId);
        return toDTO(saved, LocalDateTime.now(clock));
    }

    /**
     * Reopens a goal. A goal whose current amount still covers its target is completed
     * again on save, so callers lower the amount or raise the target first.
     */
    @Transactional
    public SavingsGoalResponseDTO reactivate(UUID userId, String id) {
        SavingsGoal goal = savingsGoalStore.requireOwned(userId, id);
        SavingsGoal saved = persist(SavingsProgressEngine.markActive(goal));
        log.info("Reactivated savings goal {} for user {} (completed={})", saved.getId(), userId, saved.isCompleted());
        return toDTO(saved, LocalDateTime.now(clock));
    }

    @Transactional
    public void delete(UUID userId, String id) {
        SavingsGoal goal = savingsGoalStore.requireOwned(userId, id);
        savingsGoalStore.softDelete(goal);
        log.info("Deleted savings goal {} for user {}", goal.getId(), userId);
    }

    @Transactional(readOnly = true)
    public SavingsStatsDTO stats(UUID userId) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<SavingsGoal> goals = savingsGoalStore.findAll(RecordQueries.savingsGoals().build(userId));

        long completed = goals.stream().filter(SavingsGoal::isCompleted).count();
        long expiringSoon = savingsGoalStore.count(
                expiringQuery(userId, now, properties.savings().expiringSoonDays()));
        BigDecimal totalTarget = sum(goals.stream().map(SavingsGoal::getTargetAmount).toList());
        BigDecimal totalCurrent = sum(goals.stream().map(SavingsGoal::getCurrentAmount).toList());
        BigDecimal totalProgress = totalTarget.signum() > 0
                ? totalCurrent.multiply(BigDecimal.valueOf(100)).divide(totalTarget, MONEY_SCALE, RoundingMode.HALF_UP)
                : BigDecimal.ZERO.setScale(MONEY_SCALE);

        return SavingsStatsDTO.builder()
                .totalGoals(goals.size())
                .activeGoals(goals.size() - completed)
                .completedGoals(completed)
                .expiringSoonCount(expiringSoon)
                .totalTargetAmount(totalTarget)
                .totalCurrentAmount(totalCurrent)
                .totalProgress(totalProgress)
                .build();
    }

    private List<SavingsGoalResponseDTO> inState(UUID userId, GoalState state, Sort sort) {
        LocalDateTime now = LocalDateTime.now(clock);
        ScopedQuery<SavingsGoal> query = RecordQueries.savingsGoals().build(userId)
                .and(RecordQueries.inState(state));
        return savingsGoalStore.findAll(query, sort).stream()
                .map(goal -> toDTO(goal, now))
                .toList();
    }

    private ScopedQuery<SavingsGoal> expiringQuery(UUID userId, LocalDateTime now, int days) {
        return RecordQueries.savingsGoals().build(userId)
                .and(RecordQueries.openWithDeadlineBy(now.plusDays(days)));
    }

    private SavingsGoal persist(SavingsGoal goal) {
        return savingsGoalStore.save(SavingsProgressEngine.applyCompletionRule(goal));
    }

    private static void requireFutureDeadline(LocalDateTime deadline, LocalDateTime now) {
        if (deadline == null || !deadline.isAfter(now)) {
            throw new BadRequestException("Deadline must be in the future");
        }
    }

    private static BigDecimal sum(List<BigDecimal> values) {
        return values.stream()
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    private SavingsGoalResponseDTO toDTO(SavingsGoal goal, LocalDateTime now) {
        return SavingsGoalResponseDTO.builder()
                .id(goal.getId().toString())
                .title(goal.getTitle())
                .targetAmount(goal.getTargetAmount())
                .currentAmount(goal.getCurrentAmount())
                .deadline(goal.getDeadline())
                .description(goal.getDescription())
                .category(goal.getCategory())
                .priority(goal.getPriority())
                .type(goal.getType())
                .completed(goal.isCompleted())
                .progressPercentage(SavingsProgressEngine.progressPercentage(goal))
                .remainingAmount(SavingsProgressEngine.remainingAmount(goal))
                .daysRemaining(SavingsProgressEngine.daysRemaining(goal, now))
                .createdAt(goal.getCreatedAt())
                .updatedAt(goal.getUpdatedAt())
                .build();
    }
}

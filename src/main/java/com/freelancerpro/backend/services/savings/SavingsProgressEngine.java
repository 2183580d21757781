package com.freelancerpro.backend.services.savings;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;

import com.freelancerpro.backend.entities.SavingsGoal;
import com.freelancerpro.backend.enums.ProgressAction;
import com.freelancerpro.backend.exceptions.BadRequestException;
import com.freelancerpro.backend.exceptions.InsufficientProgressException;

/**
 * Progress and completion transitions for a {@link SavingsGoal}.
 *
 * <p>A goal becomes completed whenever its current amount reaches the target. It
 * only goes back to active through {@link #markActive(SavingsGoal)}; lowering the
 * amount does not reopen it.
 */
public final class SavingsProgressEngine {

    private static final int MONEY_SCALE = 2;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final long DAY_MILLIS = Duration.ofDays(1).toMillis();

    private SavingsProgressEngine() {
    }

    public static SavingsGoal apply(SavingsGoal goal, ProgressAction action, BigDecimal amount) {
        return switch (action) {
            case ADD -> addProgress(goal, amount);
            case SUBTRACT -> subtractProgress(goal, amount);
        };
    }

    public static SavingsGoal addProgress(SavingsGoal goal, BigDecimal amount) {
        requirePositive(amount);
        goal.setCurrentAmount(goal.getCurrentAmount().add(amount));
        return applyCompletionRule(goal);
    }

    /**
     * @throws InsufficientProgressException when {@code amount} exceeds the current
     *                                       amount; the goal is left untouched
     */
    public static SavingsGoal subtractProgress(SavingsGoal goal, BigDecimal amount) {
        requirePositive(amount);
        BigDecimal current = goal.getCurrentAmount();
        if (amount.compareTo(current) > 0) {
            throw new InsufficientProgressException(current, amount);
        }
        goal.setCurrentAmount(clampedSubtract(current, amount));
        return applyCompletionRule(goal);
    }

    /** Must run before every save of a goal. */
    public static SavingsGoal applyCompletionRule(SavingsGoal goal) {
        if (!goal.isCompleted() && goal.getCurrentAmount().compareTo(goal.getTargetAmount()) >= 0) {
            goal.setCompleted(true);
        }
        return goal;
    }

    public static SavingsGoal markCompleted(SavingsGoal goal) {
        goal.setCompleted(true);
        return goal;
    }

    public static SavingsGoal markActive(SavingsGoal goal) {
        goal.setCompleted(false);
        return goal;
    }

    // overdrafts are rejected before this point
    static BigDecimal clampedSubtract(BigDecimal current, BigDecimal amount) {
        BigDecimal result = current.subtract(amount);
        return result.signum() < 0 ? BigDecimal.ZERO : result;
    }

    public static BigDecimal progressPercentage(SavingsGoal goal) {
        BigDecimal target = goal.getTargetAmount();
        if (target == null || target.signum() <= 0) {
            return BigDecimal.ZERO.setScale(MONEY_SCALE);
        }
        BigDecimal pct = goal.getCurrentAmount()
                .multiply(HUNDRED)
                .divide(target, MONEY_SCALE, RoundingMode.HALF_UP);
        return pct.min(HUNDRED.setScale(MONEY_SCALE));
    }

    public static BigDecimal remainingAmount(SavingsGoal goal) {
        BigDecimal remaining = goal.getTargetAmount().subtract(goal.getCurrentAmount());
        return remaining.signum() < 0 ? BigDecimal.ZERO.setScale(MONEY_SCALE) : remaining.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /** Days until the deadline, part days rounded up; negative once it has passed. */
    public static long daysRemaining(SavingsGoal goal, LocalDateTime now) {
        long millis = Duration.between(now, goal.getDeadline()).toMillis();
        return -Math.floorDiv(-millis, DAY_MILLIS);
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new BadRequestException("Amount must be greater than 0");
        }
    }
}

package com.freelancerpro.backend.services.savings;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import org.junit.jupiter.api.Test;

import com.freelancerpro.backend.entities.SavingsGoal;
import com.freelancerpro.backend.enums.ProgressAction;
import com.freelancerpro.backend.exceptions.BadRequestException;
import com.freelancerpro.backend.exceptions.ErrorKind;
import com.freelancerpro.backend.exceptions.InsufficientProgressException;

class SavingsProgressEngineTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 6, 1, 12, 0);

    private static SavingsGoal goal(String current, String target) {
        SavingsGoal goal = new SavingsGoal();
        goal.setTitle("Laptop");
        goal.setCurrentAmount(new BigDecimal(current));
        goal.setTargetAmount(new BigDecimal(target));
        goal.setDeadline(NOW.plusDays(30));
        return goal;
    }

    @Test
    void addProgress_reachingTarget_overshootsAndCompletes() {
        SavingsGoal goal = goal("80", "100");

        SavingsProgressEngine.addProgress(goal, new BigDecimal("25"));

        assertEquals(0, new BigDecimal("105").compareTo(goal.getCurrentAmount()));
        assertTrue(goal.isCompleted());
    }

    @Test
    void addProgress_belowTarget_staysActive() {
        SavingsGoal goal = goal("10", "100");

        SavingsProgressEngine.apply(goal, ProgressAction.ADD, new BigDecimal("5"));

        assertEquals(0, new BigDecimal("15").compareTo(goal.getCurrentAmount()));
        assertFalse(goal.isCompleted());
    }

    @Test
    void subtractProgress_moreThanCurrent_isRejectedAndAmountUnchanged() {
        SavingsGoal goal = goal("30", "100");

        InsufficientProgressException ex = assertThrows(InsufficientProgressException.class,
                () -> SavingsProgressEngine.subtractProgress(goal, new BigDecimal("30.01")));

        assertEquals(ErrorKind.INSUFFICIENT_PROGRESS, ex.getKind());
        assertEquals(0, new BigDecimal("30").compareTo(ex.getCurrentAmount()));
        assertEquals(0, new BigDecimal("30").compareTo(goal.getCurrentAmount()));
    }

    @Test
    void subtractProgress_exactlyCurrent_reachesZero() {
        SavingsGoal goal = goal("30", "100");

        SavingsProgressEngine.apply(goal, ProgressAction.SUBTRACT, new BigDecimal("30"));

        assertEquals(0, BigDecimal.ZERO.compareTo(goal.getCurrentAmount()));
    }

    @Test
    void subtractProgress_onCompletedGoal_doesNotReopenIt() {
        SavingsGoal goal = goal("120", "100");
        SavingsProgressEngine.applyCompletionRule(goal);

        SavingsProgressEngine.subtractProgress(goal, new BigDecimal("50"));

        assertTrue(goal.isCompleted());
    }

    @Test
    void progress_nonPositiveAmount_isInvalidInput() {
        SavingsGoal goal = goal("10", "100");

        assertThrows(BadRequestException.class, () -> SavingsProgressEngine.addProgress(goal, BigDecimal.ZERO));
        assertThrows(BadRequestException.class, () -> SavingsProgressEngine.subtractProgress(goal, new BigDecimal("-1")));
    }

    @Test
    void markActive_thenCompletionRule_completesAgainWhenTargetStillMet() {
        SavingsGoal goal = goal("100", "100");
        SavingsProgressEngine.markCompleted(goal);

        SavingsProgressEngine.markActive(goal);
        assertFalse(goal.isCompleted());

        SavingsProgressEngine.applyCompletionRule(goal);
        assertTrue(goal.isCompleted());
    }

    @Test
    void markCompleted_belowTarget_isAllowed() {
        SavingsGoal goal = goal("10", "100");

        SavingsProgressEngine.markCompleted(goal);

        assertTrue(goal.isCompleted());
    }

    @Test
    void clampedSubtract_neverGoesBelowZero() {
        assertEquals(BigDecimal.ZERO, SavingsProgressEngine.clampedSubtract(new BigDecimal("5"), new BigDecimal("8")));
        assertEquals(0, new BigDecimal("3").compareTo(
                SavingsProgressEngine.clampedSubtract(new BigDecimal("5"), new BigDecimal("2"))));
    }

    @Test
    void derivedValues_capPercentageAndRemaining() {
        SavingsGoal over = goal("150", "100");
        SavingsGoal partial = goal("25", "80");

        assertEquals(new BigDecimal("100.00"), SavingsProgressEngine.progressPercentage(over));
        assertEquals(new BigDecimal("0.00"), SavingsProgressEngine.remainingAmount(over));
        assertEquals(new BigDecimal("31.25"), SavingsProgressEngine.progressPercentage(partial));
        assertEquals(new BigDecimal("55.00"), SavingsProgressEngine.remainingAmount(partial));
    }

    @Test
    void daysRemaining_roundsPartDaysUpAndGoesNegativeAfterDeadline() {
        SavingsGoal goal = goal("0", "100");

        goal.setDeadline(NOW.plusDays(2).plusHours(1));
        assertEquals(3, SavingsProgressEngine.daysRemaining(goal, NOW));

        goal.setDeadline(NOW.minusDays(2));
        assertEquals(-2, SavingsProgressEngine.daysRemaining(goal, NOW));
    }
}

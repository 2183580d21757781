package com.freelancerpro.backend.entities;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.freelancerpro.backend.enums.GoalPriority;
import com.freelancerpro.backend.enums.GoalType;
import com.freelancerpro.backend.enums.SavingsCategory;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(
        name = "savings_goals",
        indexes = {
                @Index(name = "idx_goal_user_active_completed", columnList = "user_id, is_active, is_completed"),
                @Index(name = "idx_goal_user_deadline", columnList = "user_id, deadline")
        }
)
@Getter
@Setter
@NoArgsConstructor
public class SavingsGoal extends OwnedRecord {

    public static final String COMPLETED = "completed";
    public static final String DEADLINE = "deadline";
    public static final String CATEGORY = "category";
    public static final String PRIORITY = "priority";
    public static final String UPDATED_AT = "updatedAt";

    @Column(nullable = false, length = 100)
    private String title;

    @Column(name = "target_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal targetAmount;

    @Column(name = "current_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal currentAmount = BigDecimal.ZERO;

    @Column(nullable = false)
    private LocalDateTime deadline;

    @Column(length = 500)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private SavingsCategory category = SavingsCategory.OTHER;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private GoalPriority priority = GoalPriority.MEDIUM;

    @Enumerated(EnumType.STRING)
    @Column(name = "goal_type", nullable = false, length = 16)
    private GoalType type = GoalType.MONTHLY;

    // written only by SavingsProgressEngine
    @Column(name = "is_completed", nullable = false)
    private boolean completed;
}

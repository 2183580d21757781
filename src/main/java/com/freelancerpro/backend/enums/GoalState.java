package com.freelancerpro.backend.enums;

import java.util.Optional;

/**
 * Savings goal completion state as exposed to list filters. Maps onto the
 * stored {@code isCompleted} flag.
 */
public enum GoalState implements WireValue {
    ACTIVE("active"),
    COMPLETED("completed");

    private final String value;

    GoalState(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    public boolean completedFlag() {
        return this == COMPLETED;
    }

    public static Optional<GoalState> find(String raw) {
        return WireValue.lookup(values(), raw);
    }
}

package com.freelancerpro.backend.enums;

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum GoalPriority implements WireValue {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    GoalPriority(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<GoalPriority> find(String raw) {
        return WireValue.lookup(values(), raw);
    }

    @JsonCreator
    public static GoalPriority fromValue(String raw) {
        return find(raw).orElseThrow(() -> new IllegalArgumentException("Invalid priority: " + raw));
    }
}

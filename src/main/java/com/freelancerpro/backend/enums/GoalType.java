package com.freelancerpro.backend.enums;

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum GoalType implements WireValue {
    MONTHLY("monthly"),
    YEARLY("yearly");

    private final String value;

    GoalType(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<GoalType> find(String raw) {
        return WireValue.lookup(values(), raw);
    }

    @JsonCreator
    public static GoalType fromValue(String raw) {
        return find(raw).orElseThrow(() -> new IllegalArgumentException("Invalid goal type: " + raw));
    }
}

package com.freelancerpro.backend.enums;

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SavingsCategory implements WireValue {
    EMERGENCY_FUND("emergency-fund"),
    VACATION("vacation"),
    HOUSE("house"),
    CAR("car"),
    EDUCATION("education"),
    RETIREMENT("retirement"),
    OTHER("other");

    private final String value;

    SavingsCategory(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<SavingsCategory> find(String raw) {
        return WireValue.lookup(values(), raw);
    }

    @JsonCreator
    public static SavingsCategory fromValue(String raw) {
        return find(raw).orElseThrow(() -> new IllegalArgumentException("Invalid savings category: " + raw));
    }
}

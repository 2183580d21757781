package com.freelancerpro.backend.enums;

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum IncomeCategory implements WireValue {
    PROJECT_PAYMENT("project-payment"),
    BONUS("bonus"),
    OTHER("other");

    private final String value;

    IncomeCategory(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<IncomeCategory> find(String raw) {
        return WireValue.lookup(values(), raw);
    }

    @JsonCreator
    public static IncomeCategory fromValue(String raw) {
        return find(raw).orElseThrow(() -> new IllegalArgumentException("Invalid income category: " + raw));
    }
}

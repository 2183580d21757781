package com.freelancerpro.backend.enums;

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ExpenseCategory implements WireValue {
    SOFTWARE("software"),
    SUBSCRIPTIONS("subscriptions"),
    EQUIPMENT("equipment"),
    MARKETING("marketing"),
    OTHER("other");

    private final String value;

    ExpenseCategory(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<ExpenseCategory> find(String raw) {
        return WireValue.lookup(values(), raw);
    }

    @JsonCreator
    public static ExpenseCategory fromValue(String raw) {
        return find(raw).orElseThrow(() -> new IllegalArgumentException("Invalid expense category: " + raw));
    }
}

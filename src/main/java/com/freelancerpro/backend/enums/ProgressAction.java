package com.freelancerpro.backend.enums;

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ProgressAction implements WireValue {
    ADD("add"),
    SUBTRACT("subtract");

    private final String value;

    ProgressAction(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<ProgressAction> find(String raw) {
        return WireValue.lookup(values(), raw);
    }

    @JsonCreator
    public static ProgressAction fromValue(String raw) {
        return find(raw).orElseThrow(() -> new IllegalArgumentException("Invalid progress action: " + raw));
    }
}

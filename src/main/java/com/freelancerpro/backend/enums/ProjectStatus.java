package com.freelancerpro.backend.enums;

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ProjectStatus implements WireValue {
    ACTIVE("active"),
    COMPLETED("completed"),
    ON_HOLD("on-hold");

    private final String value;

    ProjectStatus(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<ProjectStatus> find(String raw) {
        return WireValue.lookup(values(), raw);
    }

    @JsonCreator
    public static ProjectStatus fromValue(String raw) {
        return find(raw).orElseThrow(() -> new IllegalArgumentException("Invalid project status: " + raw));
    }
}

package com.freelancerpro.backend.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * Enum whose constants travel over the API as lower-case, dash separated values
 * (e.g. {@code on-hold}, {@code project-payment}).
 */
public interface WireValue {

    String getValue();

    static <E extends Enum<E> & WireValue> Optional<E> lookup(E[] constants, String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim();
        return Arrays.stream(constants)
                .filter(c -> c.getValue().equalsIgnoreCase(normalized) || c.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}

package com.freelancerpro.backend.services.query;

import java.time.LocalDate;
import java.time.LocalDateTime;

import com.freelancerpro.backend.exceptions.BadRequestException;

/**
 * Calendar-day range; either end may be open. The end day is included up to
 * 23:59:59.999.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        if (start != null && end != null && end.isBefore(start)) {
            throw new BadRequestException("startDate must be before or equal to endDate");
        }
    }

    public static DateRange unbounded() {
        return new DateRange(null, null);
    }

    public LocalDateTime startInclusive() {
        return start == null ? null : start.atStartOfDay();
    }

    public LocalDateTime endInclusive() {
        return end == null ? null : end.atTime(23, 59, 59, 999_000_000);
    }

    public boolean isUnbounded() {
        return start == null && end == null;
    }
}

package com.freelancerpro.backend.services.query;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.UUID;

import org.springframework.data.jpa.domain.Specification;

import com.freelancerpro.backend.entities.OwnedRecord;

/**
 * Turns (owner, filters, date range) into a {@link ScopedQuery} for one entity type.
 */
public class RecordQueryBuilder<T extends OwnedRecord> {

    @FunctionalInterface
    public interface FilterTranslator<T extends OwnedRecord> {
        Specification<T> translate(RecordFilters filters);
    }

    private final String dateAttribute;
    private final FilterTranslator<T> translator;

    /**
     * @param dateAttribute attribute the date range applies to, or {@code null} when
     *                      the entity is not date-filtered
     */
    public RecordQueryBuilder(String dateAttribute, FilterTranslator<T> translator) {
        this.dateAttribute = dateAttribute;
        this.translator = translator;
    }

    public ScopedQuery<T> build(UUID ownerId) {
        return build(ownerId, RecordFilters.none(), DateRange.unbounded());
    }

    public ScopedQuery<T> build(UUID ownerId, RecordFilters filters) {
        return build(ownerId, filters, DateRange.unbounded());
    }

    public ScopedQuery<T> build(UUID ownerId, RecordFilters filters, DateRange range) {
        ScopedQuery<T> query = ScopedQuery.ownedBy(ownerId);
        if (filters != null) {
            query = query.and(translator.translate(filters));
        }
        if (range != null && dateAttribute != null) {
            LocalDateTime from = range.startInclusive();
            LocalDateTime to = range.endInclusive();
            if (from != null) {
                query = query.and(OwnedRecordSpecifications.onOrAfter(dateAttribute, from));
            }
            if (to != null) {
                query = query.and(OwnedRecordSpecifications.onOrBefore(dateAttribute, to));
            }
        }
        return query;
    }

    public ScopedQuery<T> withIds(UUID ownerId, Collection<UUID> ids) {
        if (ids == null || ids.isEmpty()) {
            return ScopedQuery.<T>ownedBy(ownerId).and(OwnedRecordSpecifications.matchesNothing());
        }
        return ScopedQuery.<T>ownedBy(ownerId).and(OwnedRecordSpecifications.idIn(ids));
    }
}

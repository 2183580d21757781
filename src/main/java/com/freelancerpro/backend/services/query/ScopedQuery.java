package com.freelancerpro.backend.services.query;

import java.util.UUID;

import org.springframework.data.jpa.domain.Specification;

import com.freelancerpro.backend.entities.OwnedRecord;

/**
 * A store query that always carries {@code userId = owner AND isActive = true}.
 * Further constraints can only be added with {@link #and(Specification)}; there is
 * no way to widen the scope once built.
 */
public final class ScopedQuery<T extends OwnedRecord> {

    private final UUID ownerId;
    private final Specification<T> constraints;

    private ScopedQuery(UUID ownerId, Specification<T> constraints) {
        if (ownerId == null) {
            throw new IllegalArgumentException("ownerId is required");
        }
        this.ownerId = ownerId;
        this.constraints = constraints;
    }

    public static <T extends OwnedRecord> ScopedQuery<T> ownedBy(UUID ownerId) {
        return new ScopedQuery<>(ownerId, null);
    }

    public ScopedQuery<T> and(Specification<T> extra) {
        if (extra == null) {
            return this;
        }
        return new ScopedQuery<>(ownerId, constraints == null ? extra : constraints.and(extra));
    }

    public UUID ownerId() {
        return ownerId;
    }

    public Specification<T> toSpecification() {
        Specification<T> scope = Specification
                .<T>where(OwnedRecordSpecifications.ownedBy(ownerId))
                .and(OwnedRecordSpecifications.activeOnly());
        return constraints == null ? scope : scope.and(constraints);
    }
}

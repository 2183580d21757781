package com.freelancerpro.backend.services.query;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.UUID;

import org.springframework.data.jpa.domain.Specification;

import com.freelancerpro.backend.entities.OwnedRecord;

final class OwnedRecordSpecifications {

    private OwnedRecordSpecifications() {
    }

    static <T extends OwnedRecord> Specification<T> ownedBy(UUID ownerId) {
        return (root, query, cb) -> cb.equal(root.get(OwnedRecord.USER_ID), ownerId);
    }

    static <T extends OwnedRecord> Specification<T> activeOnly() {
        return (root, query, cb) -> cb.isTrue(root.get(OwnedRecord.ACTIVE));
    }

    static <T extends OwnedRecord> Specification<T> attributeEquals(String attribute, Object value) {
        return (root, query, cb) -> cb.equal(root.get(attribute), value);
    }

    static <T extends OwnedRecord> Specification<T> matchesNothing() {
        return (root, query, cb) -> cb.disjunction();
    }

    static <T extends OwnedRecord> Specification<T> idIn(Collection<UUID> ids) {
        return (root, query, cb) -> root.get("id").in(ids);
    }

    static <T extends OwnedRecord> Specification<T> onOrAfter(String attribute, LocalDateTime from) {
        return (root, query, cb) -> cb.greaterThanOrEqualTo(root.<LocalDateTime>get(attribute), from);
    }

    static <T extends OwnedRecord> Specification<T> onOrBefore(String attribute, LocalDateTime to) {
        return (root, query, cb) -> cb.lessThanOrEqualTo(root.<LocalDateTime>get(attribute), to);
    }
}

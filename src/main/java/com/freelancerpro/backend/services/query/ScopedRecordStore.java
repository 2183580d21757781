package com.freelancerpro.backend.services.query;

import java.lang.reflect.Modifier;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.util.ReflectionUtils;

import com.freelancerpro.backend.entities.OwnedRecord;
import com.freelancerpro.backend.enums.SortDirection;
import com.freelancerpro.backend.exceptions.ResourceNotFoundException;
import com.freelancerpro.backend.repositories.OwnedRecordRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Owner-scoped access to one record table. All reads filter on the caller's id and
 * the active flag; records owned by someone else or soft-deleted look exactly like
 * records that do not exist.
 */
@Slf4j
public class ScopedRecordStore<T extends OwnedRecord> {

    static final Sort DEFAULT_SORT = Sort.by(Sort.Direction.DESC, OwnedRecord.CREATED_AT);

    private final OwnedRecordRepository<T> repository;
    private final String label;
    private final Set<String> sortableFields;

    public ScopedRecordStore(OwnedRecordRepository<T> repository, Class<T> type, String label) {
        this.repository = repository;
        this.label = label;
        this.sortableFields = collectFieldNames(type);
    }

    public Optional<T> findOwned(UUID ownerId, UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        ScopedQuery<T> query = ScopedQuery.<T>ownedBy(ownerId)
                .and(OwnedRecordSpecifications.attributeEquals("id", id));
        return repository.findOne(query.toSpecification());
    }

    public Optional<T> findOwned(UUID ownerId, String rawId) {
        return parseId(rawId).flatMap(id -> findOwned(ownerId, id));
    }

    public T requireOwned(UUID ownerId, String rawId) {
        return findOwned(ownerId, rawId)
                .orElseThrow(() -> new ResourceNotFoundException(label + " not found"));
    }

    public T requireOwned(UUID ownerId, UUID id) {
        return findOwned(ownerId, id)
                .orElseThrow(() -> new ResourceNotFoundException(label + " not found"));
    }

    /**
     * One page of the query's records plus the total match count. A page past the last
     * one yields no records but still reports the total.
     */
    public PageSlice<T> page(ScopedQuery<T> query, PageQuery pageQuery) {
        Specification<T> spec = query.toSpecification();
        if (pageQuery.skip() > Integer.MAX_VALUE) {
            // JPA offsets are ints; nothing can live that far out
            return new PageSlice<>(List.of(), repository.count(spec));
        }
        PageRequest request = PageRequest.of(pageQuery.page() - 1, pageQuery.limit(), resolveSort(pageQuery));
        Page<T> page = repository.findAll(spec, request);
        return new PageSlice<>(page.getContent(), page.getTotalElements());
    }

    public List<T> findAll(ScopedQuery<T> query) {
        return repository.findAll(query.toSpecification(), DEFAULT_SORT);
    }

    public List<T> findAll(ScopedQuery<T> query, Sort sort) {
        return repository.findAll(query.toSpecification(), sort);
    }

    public long count(ScopedQuery<T> query) {
        return repository.count(query.toSpecification());
    }

    public T save(T record) {
        return repository.save(record);
    }

    public void softDelete(T record) {
        record.setActive(false);
        repository.save(record);
    }

    /**
     * Unscoped lookup that also sees soft-deleted rows. For maintenance paths only,
     * never for serving a caller's request.
     */
    public Optional<T> findIncludingInactive(UUID id) {
        return repository.findById(id);
    }

    Sort resolveSort(PageQuery pageQuery) {
        if (!pageQuery.hasSortOverride()) {
            return DEFAULT_SORT;
        }
        String field = pageQuery.sortBy().trim();
        if (!sortableFields.contains(field)) {
            log.debug("Ignoring sort on unknown {} field '{}'", label, field);
            return DEFAULT_SORT;
        }
        Sort.Direction direction = pageQuery.direction() == SortDirection.ASC
                ? Sort.Direction.ASC
                : Sort.Direction.DESC;
        return Sort.by(direction, field);
    }

    private static Optional<UUID> parseId(String rawId) {
        if (rawId == null || rawId.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(rawId.trim()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static Set<String> collectFieldNames(Class<?> type) {
        Set<String> names = new HashSet<>();
        ReflectionUtils.doWithFields(type,
                field -> names.add(field.getName()),
                field -> !Modifier.isStatic(field.getModifiers()));
        return Collections.unmodifiableSet(names);
    }
}

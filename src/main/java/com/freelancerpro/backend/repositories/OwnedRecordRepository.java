package com.freelancerpro.backend.repositories;

import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.repository.NoRepositoryBean;

import com.freelancerpro.backend.entities.OwnedRecord;

/**
 * Base repository for per-user records. Services never call it directly: every
 * read goes through {@code ScopedRecordStore}, which adds the owner and
 * active-flag constraints.
 */
@NoRepositoryBean
public interface OwnedRecordRepository<T extends OwnedRecord>
        extends JpaRepository<T, UUID>, JpaSpecificationExecutor<T> {
}

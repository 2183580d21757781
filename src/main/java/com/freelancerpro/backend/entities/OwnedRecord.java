package com.freelancerpro.backend.entities;

import java.time.LocalDateTime;
import java.util.UUID;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import jakarta.persistence.Column;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import lombok.Getter;
import lombok.Setter;

/**
 * Columns shared by every per-user record table: generated id, owning user id,
 * soft-delete flag and audit timestamps.
 *
 * <p>{@code userId} is a plain column, not a relation: ownership is enforced by the
 * query layer, not by the database.
 */
@MappedSuperclass
@Getter
@Setter
public abstract class OwnedRecord {

    public static final String USER_ID = "userId";
    public static final String ACTIVE = "active";
    public static final String CREATED_AT = "createdAt";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}

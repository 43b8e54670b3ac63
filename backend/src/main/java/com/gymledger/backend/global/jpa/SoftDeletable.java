package com.gymledger.backend.global.jpa;

import java.time.OffsetDateTime;

/**
 * Tombstone capability. A row with a non-null deletion timestamp is hidden from
 * default queries but kept physically.
 */
public interface SoftDeletable {

    OffsetDateTime getDeletedAt();

    void markDeleted(OffsetDateTime deletedAt);

    void clearDeleted();

    default boolean isDeleted() {
        return getDeletedAt() != null;
    }
}

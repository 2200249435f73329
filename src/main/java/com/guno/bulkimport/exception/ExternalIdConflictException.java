package com.guno.bulkimport.exception;

import lombok.Getter;

/**
 * An external identifier is already registered for a different instance of the same entity type
 */
@Getter
public class ExternalIdConflictException extends RowPersistenceException {

    private final String entityType;
    private final String externalKey;

    public ExternalIdConflictException(String entityType, String externalKey, Long existingId, Long requestedId) {
        super("External ID " + externalKey + " for " + entityType + " is already registered to instance "
                + existingId + " and cannot be registered to instance " + requestedId);
        this.entityType = entityType;
        this.externalKey = externalKey;
    }

    public ExternalIdConflictException(String entityType, String externalKey, Throwable cause) {
        super("External ID " + externalKey + " for " + entityType + " was registered concurrently", cause);
        this.entityType = entityType;
        this.externalKey = externalKey;
    }
}

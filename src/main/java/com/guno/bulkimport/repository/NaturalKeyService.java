package com.guno.bulkimport.repository;

import java.util.Optional;

/**
 * Lookup and creation of instances by their natural key (for example a type's unique name)
 */
public interface NaturalKeyService {

    /**
     * Case-insensitive lookup on the natural key of the entity type
     */
    Optional<Long> find(String entityType, String value);

    /**
     * Create an instance carrying only its natural key
     */
    long create(String entityType, String value);
}

package com.guno.bulkimport.repository;

import java.util.Map;
import java.util.Optional;

/**
 * Per-entity-type persistence of record instances. Values are keyed by field name.
 */
public interface EntityStore {

    long create(String entityType, Map<String, Object> values);

    void update(String entityType, long id, Map<String, Object> values);

    Optional<Map<String, Object>> findById(String entityType, long id);

    boolean exists(String entityType, long id);

    void delete(String entityType, long id);

    long count(String entityType);
}

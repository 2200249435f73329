package com.guno.bulkimport.schema;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Schema Registry - fixed table of entity type -> fields, built once at startup.
 * Relation targets are checked when the registry is assembled so that the column mapper
 * never meets a dangling entity type.
 */
@Slf4j
public class SchemaRegistry {

    private final Map<String, EntitySchema> entities;

    public SchemaRegistry(List<EntitySchema> schemas) {
        Map<String, EntitySchema> byName = new LinkedHashMap<>();
        for (EntitySchema schema : schemas) {
            if (byName.putIfAbsent(schema.getName(), schema) != null) {
                throw new IllegalArgumentException("Entity type " + schema.getName() + " registered twice");
            }
        }
        for (EntitySchema schema : byName.values()) {
            for (FieldDef field : schema.getFields().values()) {
                if (field.isRelation() && !byName.containsKey(field.getTarget())) {
                    throw new IllegalArgumentException("Field " + schema.getName() + "." + field.getName()
                            + " targets unknown entity type " + field.getTarget());
                }
            }
        }
        this.entities = Collections.unmodifiableMap(byName);
        log.info("Schema registry initialized with {} entity types: {}", entities.size(), entities.keySet());
    }

    public Optional<EntitySchema> find(String entityType) {
        return Optional.ofNullable(entities.get(entityType));
    }

    public EntitySchema get(String entityType) {
        EntitySchema schema = entities.get(entityType);
        if (schema == null) {
            throw new IllegalArgumentException("Unknown entity type: " + entityType);
        }
        return schema;
    }

    public boolean contains(String entityType) {
        return entities.containsKey(entityType);
    }

    public Collection<EntitySchema> all() {
        return entities.values();
    }
}

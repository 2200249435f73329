package com.guno.bulkimport.repository;

import com.guno.bulkimport.exception.RowValidationException;
import com.guno.bulkimport.schema.EntitySchema;
import com.guno.bulkimport.schema.SchemaRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Natural Key Service - case-insensitive lookups on each type's natural key column
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JdbcNaturalKeyService implements NaturalKeyService {

    private final JdbcTemplate jdbcTemplate;
    private final SchemaRegistry schemaRegistry;
    private final EntityStore entityStore;

    @Override
    public Optional<Long> find(String entityType, String value) {
        EntitySchema schema = naturallyKeyed(entityType);
        String column = schema.naturalKeyField().getColumn();

        List<Long> ids = jdbcTemplate.queryForList(
                "SELECT id FROM " + schema.getTable() + " WHERE LOWER(" + column + ") = LOWER(?) ORDER BY id",
                Long.class, value);

        if (ids.size() > 1) {
            throw new RowValidationException("Found " + ids.size() + " " + entityType + " records named "
                    + value + "; use a primary key or external ID reference instead.");
        }
        return ids.stream().findFirst();
    }

    @Override
    public long create(String entityType, String value) {
        EntitySchema schema = naturallyKeyed(entityType);
        long id = entityStore.create(entityType, Map.of(schema.getNaturalKey(), value));
        log.info("Created {} #{} from natural key '{}'", entityType, id, value);
        return id;
    }

    private EntitySchema naturallyKeyed(String entityType) {
        EntitySchema schema = schemaRegistry.get(entityType);
        if (!schema.hasNaturalKey()) {
            throw new IllegalArgumentException(entityType + " has no natural key");
        }
        return schema;
    }
}

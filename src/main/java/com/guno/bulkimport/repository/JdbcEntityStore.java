package com.guno.bulkimport.repository;

import com.guno.bulkimport.exception.RowPersistenceException;
import com.guno.bulkimport.schema.EntitySchema;
import com.guno.bulkimport.schema.FieldDef;
import com.guno.bulkimport.schema.FieldType;
import com.guno.bulkimport.schema.SchemaRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.Timestamp;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Entity Store - JDBC operations for record tables, SQL assembled from the schema registry
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class JdbcEntityStore implements EntityStore {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final SchemaRegistry schemaRegistry;

    @Override
    public long create(String entityType, Map<String, Object> values) {
        EntitySchema schema = schemaRegistry.get(entityType);
        MapSqlParameterSource params = toParams(schema, values);

        String sql;
        if (values.isEmpty()) {
            sql = "INSERT INTO " + schema.getTable() + " DEFAULT VALUES";
        } else {
            String columns = String.join(", ", params.getParameterNames());
            String placeholders = Arrays.stream(params.getParameterNames())
                    .map(c -> ":" + c)
                    .collect(Collectors.joining(", "));
            sql = "INSERT INTO " + schema.getTable() + " (" + columns + ") VALUES (" + placeholders + ")";
        }

        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbcTemplate.update(sql, params, keyHolder, new String[]{"id"});
        } catch (DataAccessException e) {
            throw translate(entityType, e);
        }

        Number key = keyHolder.getKey();
        if (key == null) {
            throw new RowPersistenceException("No id was generated for new " + entityType);
        }
        log.debug("Created {} #{}", entityType, key);
        return key.longValue();
    }

    @Override
    public void update(String entityType, long id, Map<String, Object> values) {
        if (values.isEmpty()) return;

        EntitySchema schema = schemaRegistry.get(entityType);
        MapSqlParameterSource params = toParams(schema, values);
        String assignments = Arrays.stream(params.getParameterNames())
                .map(c -> c + " = :" + c)
                .collect(Collectors.joining(", "));
        params.addValue("id", id);

        int updated;
        try {
            updated = jdbcTemplate.update(
                    "UPDATE " + schema.getTable() + " SET " + assignments + " WHERE id = :id", params);
        } catch (DataAccessException e) {
            throw translate(entityType, e);
        }
        if (updated == 0) {
            throw new RowPersistenceException(entityType + " #" + id + " no longer exists");
        }
        log.debug("Updated {} #{} ({} fields)", entityType, id, values.size());
    }

    @Override
    public Optional<Map<String, Object>> findById(String entityType, long id) {
        EntitySchema schema = schemaRegistry.get(entityType);
        List<Map<String, Object>> rows = jdbcTemplate.query(
                "SELECT * FROM " + schema.getTable() + " WHERE id = :id",
                new MapSqlParameterSource("id", id),
                (rs, rowNum) -> {
                    Map<String, Object> values = new LinkedHashMap<>();
                    for (FieldDef field : schema.getFields().values()) {
                        values.put(field.getName(), normalize(field, rs.getObject(field.getColumn())));
                    }
                    return values;
                });
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public boolean exists(String entityType, long id) {
        EntitySchema schema = schemaRegistry.get(entityType);
        return !jdbcTemplate.queryForList(
                "SELECT 1 FROM " + schema.getTable() + " WHERE id = :id",
                new MapSqlParameterSource("id", id)).isEmpty();
    }

    @Override
    public void delete(String entityType, long id) {
        EntitySchema schema = schemaRegistry.get(entityType);
        jdbcTemplate.update("DELETE FROM " + schema.getTable() + " WHERE id = :id",
                new MapSqlParameterSource("id", id));
        log.debug("Deleted {} #{}", entityType, id);
    }

    @Override
    public long count(String entityType) {
        EntitySchema schema = schemaRegistry.get(entityType);
        Long count = jdbcTemplate.getJdbcTemplate()
                .queryForObject("SELECT COUNT(*) FROM " + schema.getTable(), Long.class);
        return count == null ? 0 : count;
    }

    // === Helper Methods ===

    private MapSqlParameterSource toParams(EntitySchema schema, Map<String, Object> values) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        values.forEach((fieldName, value) -> {
            FieldDef field = schema.field(fieldName).orElseThrow(() ->
                    new IllegalArgumentException("Unknown field " + schema.getName() + "." + fieldName));
            params.addValue(field.getColumn(), value);
        });
        return params;
    }

    private Object normalize(FieldDef field, Object raw) {
        if (raw == null) return null;
        if (raw instanceof Date) return ((Date) raw).toLocalDate();
        if (raw instanceof Timestamp) return ((Timestamp) raw).toLocalDateTime();
        if (field.getType() == FieldType.RELATION || field.getType() == FieldType.INTEGER) {
            return ((Number) raw).longValue();
        }
        if (field.getType() == FieldType.DECIMAL && !(raw instanceof BigDecimal)) {
            return new BigDecimal(raw.toString());
        }
        return raw;
    }

    private RowPersistenceException translate(String entityType, DataAccessException e) {
        String message = e.getMostSpecificCause().getMessage();
        log.warn("Store rejected {}: {}", entityType, message);
        return new RowPersistenceException(message, e);
    }
}

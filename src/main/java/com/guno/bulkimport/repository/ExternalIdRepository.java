package com.guno.bulkimport.repository;

import com.guno.bulkimport.entity.ExternalIdMapping;
import com.guno.bulkimport.exception.ExternalIdConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * External ID Repository - JDBC operations for import_external_id.
 * A key is never re-pointed: registering it for a different instance is a conflict.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class ExternalIdRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String INSERT_SQL = """
        INSERT INTO import_external_id (entity_type, external_key, instance_id, submission_id, created_at)
        VALUES (?, ?, ?, ?, ?)
        """;

    public Optional<Long> findInstanceId(String entityType, String externalKey) {
        List<Long> ids = jdbcTemplate.queryForList(
                "SELECT instance_id FROM import_external_id WHERE entity_type = ? AND external_key = ?",
                Long.class, entityType, externalKey);
        return ids.stream().findFirst();
    }

    /**
     * Register a key for an instance. Re-registering the same pair is a no-op.
     */
    public void register(String entityType, String externalKey, long instanceId, Long submissionId) {
        Optional<Long> existing = findInstanceId(entityType, externalKey);
        if (existing.isPresent()) {
            if (existing.get() != instanceId) {
                throw new ExternalIdConflictException(entityType, externalKey, existing.get(), instanceId);
            }
            return;
        }

        try {
            jdbcTemplate.update(INSERT_SQL, entityType, externalKey, instanceId, submissionId, LocalDateTime.now());
            log.debug("Registered external ID {} for {} #{}", externalKey, entityType, instanceId);
        } catch (DuplicateKeyException e) {
            throw new ExternalIdConflictException(entityType, externalKey, e);
        }
    }

    public int deleteByInstance(String entityType, long instanceId) {
        return jdbcTemplate.update(
                "DELETE FROM import_external_id WHERE entity_type = ? AND instance_id = ?",
                entityType, instanceId);
    }

    public List<ExternalIdMapping> findByEntityType(String entityType) {
        return jdbcTemplate.query(
                "SELECT * FROM import_external_id WHERE entity_type = ? ORDER BY external_key",
                mappingRowMapper(), entityType);
    }

    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM import_external_id", Long.class);
        return count == null ? 0 : count;
    }

    private RowMapper<ExternalIdMapping> mappingRowMapper() {
        return (rs, rowNum) -> ExternalIdMapping.builder()
                .entityType(rs.getString("entity_type"))
                .externalKey(rs.getString("external_key"))
                .instanceId(rs.getLong("instance_id"))
                .submissionId(rs.getObject("submission_id", Long.class))
                .createdAt(rs.getObject("created_at", LocalDateTime.class))
                .build();
    }
}

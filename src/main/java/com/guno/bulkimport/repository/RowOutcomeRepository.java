package com.guno.bulkimport.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guno.bulkimport.entity.OutcomeAction;
import com.guno.bulkimport.entity.OutcomeOrigin;
import com.guno.bulkimport.entity.RowOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * Row Outcome Repository - append-only JDBC operations for import_row_outcome
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class RowOutcomeRepository {

    private static final TypeReference<List<String>> ERRORS_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    private static final String INSERT_SQL = """
        INSERT INTO import_row_outcome (
            submission_id, row_num, entity_type, origin, outcome, instance_id, errors, seq_no
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        """;

    public int insertAll(List<RowOutcome> outcomes) {
        if (outcomes == null || outcomes.isEmpty()) return 0;

        List<Object[]> params = outcomes.stream().map(this::mapToParams).toList();
        int[] results = jdbcTemplate.batchUpdate(INSERT_SQL, params);
        log.debug("Inserted {} row outcomes", results.length);
        return results.length;
    }

    public void insert(RowOutcome outcome) {
        jdbcTemplate.update(INSERT_SQL, mapToParams(outcome));
    }

    /**
     * Outcomes of a submission in commit sequence
     */
    public List<RowOutcome> findBySubmission(long submissionId) {
        return jdbcTemplate.query(
                "SELECT * FROM import_row_outcome WHERE submission_id = ? ORDER BY seq_no, id",
                outcomeRowMapper(), submissionId);
    }

    public long countBySubmission(long submissionId) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM import_row_outcome WHERE submission_id = ?", Long.class, submissionId);
        return count == null ? 0 : count;
    }

    // === Helper Methods ===

    private Object[] mapToParams(RowOutcome o) {
        return new Object[]{
                o.getSubmissionId(),
                o.getRowNumber(),
                o.getEntityType(),
                o.getOrigin().name(),
                o.getAction().name(),
                o.getInstanceId(),
                writeErrors(o.getErrors()),
                o.getSequence()
        };
    }

    private String writeErrors(List<String> errors) {
        if (errors == null || errors.isEmpty()) return null;
        try {
            return objectMapper.writeValueAsString(errors);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize row errors", e);
        }
    }

    private List<String> readErrors(String json) {
        if (json == null || json.isBlank()) return new ArrayList<>();
        try {
            return new ArrayList<>(objectMapper.readValue(json, ERRORS_TYPE));
        } catch (JsonProcessingException e) {
            return new ArrayList<>(List.of(json));
        }
    }

    private RowMapper<RowOutcome> outcomeRowMapper() {
        return (rs, rowNum) -> RowOutcome.builder()
                .id(rs.getLong("id"))
                .submissionId(rs.getLong("submission_id"))
                .rowNumber(rs.getInt("row_num"))
                .entityType(rs.getString("entity_type"))
                .origin(OutcomeOrigin.valueOf(rs.getString("origin")))
                .action(OutcomeAction.valueOf(rs.getString("outcome")))
                .instanceId(rs.getObject("instance_id", Long.class))
                .errors(readErrors(rs.getString("errors")))
                .sequence(rs.getLong("seq_no"))
                .build();
    }
}

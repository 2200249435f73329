package com.guno.bulkimport.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guno.bulkimport.dto.EntityCounts;
import com.guno.bulkimport.entity.ImportAction;
import com.guno.bulkimport.entity.Submission;
import com.guno.bulkimport.entity.SubmissionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Submission Repository - JDBC operations for import_submission
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class SubmissionRepository {

    private static final TypeReference<LinkedHashMap<String, EntityCounts>> COUNTS_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    private static final String INSERT_SQL = """
        INSERT INTO import_submission (
            file_name, import_action, dry_run, status, created_at, started_at, completed_at,
            plan_order, counts, total_rows, processed_rows, errors
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private static final String UPDATE_SQL = """
        UPDATE import_submission SET
            status = ?, started_at = ?, completed_at = ?, plan_order = ?, counts = ?,
            total_rows = ?, processed_rows = ?, errors = ?
        WHERE id = ?
        """;

    public Submission insert(Submission submission) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(INSERT_SQL, new String[]{"id"});
            ps.setString(1, submission.getFileName());
            ps.setString(2, submission.getAction().name());
            ps.setBoolean(3, submission.isDryRun());
            ps.setString(4, submission.getStatus().name());
            ps.setObject(5, submission.getCreatedAt());
            ps.setObject(6, submission.getStartedAt());
            ps.setObject(7, submission.getCompletedAt());
            ps.setString(8, String.join(",", submission.getPlanOrder()));
            ps.setString(9, writeCounts(submission.getCounts()));
            ps.setInt(10, submission.getTotalRows());
            ps.setInt(11, submission.getProcessedRows());
            ps.setString(12, submission.getErrors());
            return ps;
        }, keyHolder);

        submission.setId(keyHolder.getKey().longValue());
        log.info("📋 Submission #{} registered for {} ({}, dryRun={})",
                submission.getId(), submission.getFileName(), submission.getAction(), submission.isDryRun());
        return submission;
    }

    public void update(Submission submission) {
        jdbcTemplate.update(UPDATE_SQL,
                submission.getStatus().name(),
                submission.getStartedAt(),
                submission.getCompletedAt(),
                String.join(",", submission.getPlanOrder()),
                writeCounts(submission.getCounts()),
                submission.getTotalRows(),
                submission.getProcessedRows(),
                submission.getErrors(),
                submission.getId());
    }

    public void updateProgress(long submissionId, int processedRows) {
        jdbcTemplate.update("UPDATE import_submission SET processed_rows = ? WHERE id = ?", processedRows, submissionId);
    }

    public Optional<Submission> findById(long id) {
        List<Submission> results = jdbcTemplate.query(
                "SELECT * FROM import_submission WHERE id = ?", submissionRowMapper(), id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Most recent submissions first
     */
    public List<Submission> findRecent(int limit) {
        return jdbcTemplate.query(
                "SELECT * FROM import_submission ORDER BY created_at DESC, id DESC LIMIT ?",
                submissionRowMapper(), limit);
    }

    // === Helper Methods ===

    private String writeCounts(Map<String, EntityCounts> counts) {
        try {
            return objectMapper.writeValueAsString(counts);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize submission counts", e);
        }
    }

    private Map<String, EntityCounts> readCounts(String json) {
        if (json == null || json.isBlank()) return new LinkedHashMap<>();
        try {
            return objectMapper.readValue(json, COUNTS_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable counts on submission: {}", e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    private List<String> readPlanOrder(String planOrder) {
        if (planOrder == null || planOrder.isBlank()) return new ArrayList<>();
        return new ArrayList<>(Arrays.asList(planOrder.split(",")));
    }

    private RowMapper<Submission> submissionRowMapper() {
        return (rs, rowNum) -> Submission.builder()
                .id(rs.getLong("id"))
                .fileName(rs.getString("file_name"))
                .action(ImportAction.valueOf(rs.getString("import_action")))
                .dryRun(rs.getBoolean("dry_run"))
                .status(SubmissionStatus.valueOf(rs.getString("status")))
                .createdAt(rs.getObject("created_at", LocalDateTime.class))
                .startedAt(rs.getObject("started_at", LocalDateTime.class))
                .completedAt(rs.getObject("completed_at", LocalDateTime.class))
                .planOrder(readPlanOrder(rs.getString("plan_order")))
                .counts(readCounts(rs.getString("counts")))
                .totalRows(rs.getInt("total_rows"))
                .processedRows(rs.getInt("processed_rows"))
                .errors(rs.getString("errors"))
                .build();
    }
}

package com.guno.bulkimport.runner;

import com.guno.bulkimport.entity.ImportAction;
import com.guno.bulkimport.entity.RowOutcome;
import com.guno.bulkimport.entity.Submission;
import com.guno.bulkimport.exception.BulkImportException;
import com.guno.bulkimport.exception.SubmissionPlanningException;
import com.guno.bulkimport.planner.ImportPlan;
import com.guno.bulkimport.service.BulkImportService;
import com.guno.bulkimport.service.ImportReport;
import com.guno.bulkimport.service.ReversalResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * ImportCommandRunner - runs one bulk import command from the command line
 *
 * Usage:
 *   --bulk-import.command=validate --bulk-import.file=people.csv --bulk-import.action=CREATE
 *   --bulk-import.command=reverse --bulk-import.submission=42
 *   --bulk-import.command=history
 */
@Component
@ConditionalOnProperty(prefix = "bulk-import", name = "command")
@RequiredArgsConstructor
@Slf4j
public class ImportCommandRunner implements ApplicationRunner {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final BulkImportService bulkImportService;

    @Value("${bulk-import.command}")
    private String command;

    @Value("${bulk-import.file:}")
    private String file;

    @Value("${bulk-import.action:CREATE}")
    private ImportAction action;

    @Value("${bulk-import.submission:0}")
    private long submissionId;

    @Value("${bulk-import.history-limit:20}")
    private int historyLimit;

    @Override
    public void run(ApplicationArguments args) {
        String startTime = LocalDateTime.now().format(TIME_FORMATTER);
        log.info("╔════════════════════════════════════════════════════════════╗");
        log.info("║   BULK IMPORT {} STARTED at {}", command.toUpperCase(), startTime);
        log.info("╚════════════════════════════════════════════════════════════╝");

        try {
            switch (command.toLowerCase()) {
                case "plan" -> plan();
                case "validate" -> logReport(withFile(in -> bulkImportService.validate(fileName(), in, action)));
                case "commit" -> logReport(withFile(in -> bulkImportService.commit(fileName(), in, action)));
                case "reverse" -> reverse();
                case "history" -> history();
                default -> log.error("❌ Unknown command '{}'; expected plan, validate, commit, reverse or history",
                        command);
            }
        } catch (SubmissionPlanningException e) {
            log.error("❌ Planning failed:");
            e.getProblems().forEach(p -> log.error("   - {}", p));
        } catch (BulkImportException | UncheckedIOException e) {
            log.error("❌ {} failed: {}", command, e.getMessage());
        }

        log.info("╔════════════════════════════════════════════════════════════╗");
        log.info("║   BULK IMPORT {} COMPLETED at {}", command.toUpperCase(), LocalDateTime.now().format(TIME_FORMATTER));
        log.info("╚════════════════════════════════════════════════════════════╝");
    }

    // ================================
    // COMMANDS
    // ================================

    private void plan() {
        ImportPlan plan = withFile(in -> bulkImportService.plan(fileName(), in, action));
        log.info("📋 Entity order: {}", plan.getOrder());
        plan.getOrder().forEach(type -> log.info("   {} <- {}{}", type,
                plan.getMapping().columnsFor(type).stream().map(c -> c.getHeader()).toList(),
                plan.isSequential(type) ? " (row order)" : ""));
    }

    private void reverse() {
        if (submissionId <= 0) {
            log.error("❌ --bulk-import.submission is required for reverse");
            return;
        }
        ReversalResult result = bulkImportService.reverse(submissionId);
        log.info("✅ Reversed submission #{} - deleted: {}, external IDs removed: {}, updates left: {}",
                result.getSubmissionId(), result.getDeleted(), result.getMappingsRemoved(),
                result.getUpdatesLeftInPlace());
        result.getDeletedByType().forEach((type, count) -> log.info("   {}: {}", type, count));
    }

    private void history() {
        for (Submission s : bulkImportService.history(historyLimit)) {
            log.info("   #{} {} {} {} dryRun={} rows={}/{} created={}",
                    s.getId(),
                    s.getCreatedAt() == null ? "" : s.getCreatedAt().format(TIME_FORMATTER),
                    s.getFileName(), s.getStatus(), s.isDryRun(), s.getProcessedRows(), s.getTotalRows(),
                    s.getCounts().values().stream().mapToInt(c -> c.getCreated()).sum());
        }
    }

    private void logReport(ImportReport report) {
        Submission submission = report.getSubmission();
        log.info("📊 Submission #{} finished as {}", submission.getId(), submission.getStatus());
        report.getCounts().forEach((type, c) -> log.info("   {} - created: {}, updated: {}, errored: {}, skipped: {}",
                type, c.getCreated(), c.getUpdated(), c.getErrored(), c.getSkipped()));
        for (RowOutcome error : report.getErrors()) {
            log.warn("   Row {} {}: {}", error.getRowNumber(), error.getEntityType(), error.getErrorText());
        }
    }

    // === Helper Methods ===

    private String fileName() {
        return Path.of(file).getFileName().toString();
    }

    private <T> T withFile(FileCommand<T> body) {
        if (file == null || file.isBlank()) {
            throw new BulkImportException("--bulk-import.file is required for " + command);
        }
        try (InputStream in = Files.newInputStream(Path.of(file))) {
            return body.apply(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    @FunctionalInterface
    private interface FileCommand<T> {
        T apply(InputStream in);
    }
}

package com.guno.bulkimport.service;

import com.guno.bulkimport.entity.ExternalIdMapping;
import com.guno.bulkimport.entity.ImportAction;
import com.guno.bulkimport.entity.Submission;
import com.guno.bulkimport.exception.SubmissionNotFoundException;
import com.guno.bulkimport.exception.SubmissionPlanningException;
import com.guno.bulkimport.planner.ImportPlan;
import com.guno.bulkimport.processor.CancellationRegistry;
import com.guno.bulkimport.processor.SubmissionEngine;
import com.guno.bulkimport.repository.ExternalIdRepository;
import com.guno.bulkimport.repository.RowOutcomeRepository;
import com.guno.bulkimport.repository.SubmissionRepository;
import com.guno.bulkimport.schema.SchemaRegistry;
import com.guno.bulkimport.sheet.ParsedSheet;
import com.guno.bulkimport.sheet.SheetReader;
import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Bulk Import Service - entry point for planning, validating, committing and reversing submissions
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BulkImportService {

    private final SheetReader sheetReader;
    private final SubmissionEngine submissionEngine;
    private final ReversalService reversalService;
    private final OutcomeReporter outcomeReporter;
    private final SubmissionRepository submissionRepository;
    private final RowOutcomeRepository rowOutcomeRepository;
    private final ExternalIdRepository externalIdRepository;
    private final CancellationRegistry cancellationRegistry;
    private final SchemaRegistry schemaRegistry;

    @Qualifier("submissionExecutor")
    private final ExecutorService submissionExecutor;

    // ================================
    // PLANNING
    // ================================

    /**
     * Decode the headers and order the entity types without touching the store
     */
    public ImportPlan plan(String fileName, InputStream content, ImportAction action) {
        ParsedSheet sheet = sheetReader.read(fileName, content);
        return submissionEngine.plan(sheet, action);
    }

    // ================================
    // SYNCHRONOUS RUNS
    // ================================

    /**
     * Dry run: every row is processed and reported, then all record changes are rolled back
     */
    public ImportReport validate(String fileName, InputStream content, ImportAction action) {
        return run(fileName, content, action, true);
    }

    public ImportReport commit(String fileName, InputStream content, ImportAction action) {
        return run(fileName, content, action, false);
    }

    private ImportReport run(String fileName, InputStream content, ImportAction action, boolean dryRun) {
        Submission submission = submissionEngine.register(fileName, action, dryRun);
        ParsedSheet sheet = readOrFail(submission, fileName, content);
        submissionEngine.execute(submission, sheet);
        return report(submission.getId());
    }

    // ================================
    // BACKGROUND RUNS
    // ================================

    /**
     * Read the file now and process it in the background; poll {@link #getSubmission(long)} for progress
     */
    public long submit(String fileName, InputStream content, ImportAction action, boolean dryRun) {
        Submission submission = submissionEngine.register(fileName, action, dryRun);
        ParsedSheet sheet = readOrFail(submission, fileName, content);

        submissionExecutor.submit(() -> {
            try {
                submissionEngine.execute(submission, sheet);
            } catch (SubmissionPlanningException e) {
                log.warn("Background submission #{} failed planning", submission.getId());
            } catch (RuntimeException e) {
                log.error("❌ Background submission #{} failed: {}", submission.getId(), e.getMessage(), e);
            }
        });
        log.info("📋 Submission #{} queued", submission.getId());
        return submission.getId();
    }

    /**
     * Request cancellation; rows not yet started are skipped. Returns false when the submission already finished.
     */
    public boolean cancel(long submissionId) {
        Submission submission = getSubmission(submissionId);
        if (submission.isCompleted()) {
            log.info("Submission #{} already finished as {}", submissionId, submission.getStatus());
            return false;
        }
        cancellationRegistry.cancel(submissionId);
        return true;
    }

    // ================================
    // LEDGER QUERIES
    // ================================

    public Submission getSubmission(long submissionId) {
        return submissionRepository.findById(submissionId)
                .orElseThrow(() -> new SubmissionNotFoundException(submissionId));
    }

    public ImportReport report(long submissionId) {
        Submission submission = getSubmission(submissionId);
        return outcomeReporter.report(submission, rowOutcomeRepository.findBySubmission(submissionId));
    }

    public void writeReport(long submissionId, Writer writer) {
        outcomeReporter.writeCsv(report(submissionId), writer);
    }

    /**
     * Most recent submissions, newest first
     */
    public List<Submission> history(int limit) {
        return submissionRepository.findRecent(limit);
    }

    public ReversalResult reverse(long submissionId) {
        return reversalService.reverse(submissionId);
    }

    /**
     * Write {@code external_id,instance_id} for every mapped instance of one entity type
     */
    public int exportExternalIds(String entityType, Writer writer) {
        schemaRegistry.get(entityType);
        List<ExternalIdMapping> mappings = externalIdRepository.findByEntityType(entityType);

        CSVWriter csvWriter = new CSVWriter(writer,
                ICSVWriter.DEFAULT_SEPARATOR,
                ICSVWriter.DEFAULT_QUOTE_CHARACTER,
                ICSVWriter.DEFAULT_ESCAPE_CHARACTER,
                ICSVWriter.DEFAULT_LINE_END);
        csvWriter.writeNext(new String[]{"external_id", "instance_id"}, false);
        for (ExternalIdMapping mapping : mappings) {
            csvWriter.writeNext(new String[]{mapping.getExternalKey(), String.valueOf(mapping.getInstanceId())}, false);
        }
        try {
            csvWriter.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to export external IDs", e);
        }
        log.info("Exported {} {} external IDs", mappings.size(), entityType);
        return mappings.size();
    }

    private ParsedSheet readOrFail(Submission submission, String fileName, InputStream content) {
        try {
            return sheetReader.read(fileName, content);
        } catch (SubmissionPlanningException e) {
            submissionEngine.failPlanning(submission, e);
            throw e;
        }
    }
}

package com.guno.bulkimport.processor;

import com.guno.bulkimport.entity.ImportAction;
import com.guno.bulkimport.entity.Submission;
import com.guno.bulkimport.entity.SubmissionStatus;
import com.guno.bulkimport.exception.BulkImportException;
import com.guno.bulkimport.exception.SubmissionPlanningException;
import com.guno.bulkimport.mapper.ColumnMapping;
import com.guno.bulkimport.mapper.ColumnRole;
import com.guno.bulkimport.mapper.ColumnMapper;
import com.guno.bulkimport.mapper.ColumnSpec;
import com.guno.bulkimport.planner.ImportPlan;
import com.guno.bulkimport.planner.ImportPlanner;
import com.guno.bulkimport.repository.RowOutcomeRepository;
import com.guno.bulkimport.repository.SubmissionRepository;
import com.guno.bulkimport.sheet.ParsedSheet;
import com.guno.bulkimport.sheet.SheetRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Submission Engine - drives one submission through planning, row processing and completion.
 * Entity types run one after another in planned order; rows of a type run on the row executor
 * unless they must be processed in row order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubmissionEngine {

    private static final int PROGRESS_INTERVAL = 25;

    private final ColumnMapper columnMapper;
    private final ImportPlanner importPlanner;
    private final RowProcessor rowProcessor;
    private final SubmissionRepository submissionRepository;
    private final RowOutcomeRepository rowOutcomeRepository;
    private final CancellationRegistry cancellationRegistry;

    @Qualifier("rowExecutor")
    private final ExecutorService rowExecutor;

    @Qualifier("requiresNewTransaction")
    private final TransactionTemplate requiresNewTransaction;

    @Qualifier("nestedTransaction")
    private final TransactionTemplate nestedTransaction;

    @Qualifier("requiredTransaction")
    private final TransactionTemplate requiredTransaction;

    // ================================
    // LIFECYCLE
    // ================================

    public Submission register(String fileName, ImportAction action, boolean dryRun) {
        Submission submission = Submission.builder()
                .fileName(fileName)
                .action(action)
                .dryRun(dryRun)
                .status(SubmissionStatus.CREATED)
                .createdAt(LocalDateTime.now())
                .build();
        return requiresNewTransaction.execute(status -> submissionRepository.insert(submission));
    }

    public ImportPlan plan(ParsedSheet sheet, ImportAction action) {
        if (action == ImportAction.REVERSE) {
            throw new SubmissionPlanningException("REVERSE is applied to an existing submission, not to a file.");
        }
        ColumnMapping mapping = columnMapper.map(sheet.getHeaders(), action);
        return importPlanner.plan(mapping, action);
    }

    public void failPlanning(Submission submission, SubmissionPlanningException e) {
        submission.setStatus(SubmissionStatus.PLANNING_FAILED);
        submission.setErrors(e.getMessage());
        submission.setCompletedAt(LocalDateTime.now());
        save(submission);
        cancellationRegistry.clear(submission.getId());
        log.warn("❌ Submission #{} failed planning: {}", submission.getId(), e.getMessage());
    }

    /**
     * Run a registered submission to completion on the calling thread
     */
    public Submission execute(Submission submission, ParsedSheet sheet) {
        long startTime = System.currentTimeMillis();
        log.info("🚀 Submission #{} started - file: {}, action: {}, dryRun: {}, rows: {}",
                submission.getId(), submission.getFileName(), submission.getAction(),
                submission.isDryRun(), sheet.getRowCount());

        submission.setStatus(SubmissionStatus.PLANNING);
        submission.setStartedAt(LocalDateTime.now());
        save(submission);

        ImportPlan plan;
        Map<String, List<RowInstance>> instances;
        TokenRegistry tokens = new TokenRegistry();
        try {
            plan = plan(sheet, submission.getAction());
            instances = buildInstances(sheet, plan);
            declareTokens(plan, instances, tokens);
        } catch (SubmissionPlanningException e) {
            failPlanning(submission, e);
            throw e;
        }

        int total = instances.values().stream().mapToInt(List::size).sum();
        submission.setPlanOrder(new ArrayList<>(plan.getOrder()));
        submission.setTotalRows(total);
        submission.setStatus(submission.isDryRun() ? SubmissionStatus.VALIDATING : SubmissionStatus.COMMITTING);
        save(submission);

        SubmissionLedger ledger = new SubmissionLedger(submission.getId(), submission.isDryRun(),
                rowOutcomeRepository, plan.getOrder());
        ProcessingContext context = ProcessingContext.builder()
                .submissionId(submission.getId())
                .action(submission.getAction())
                .dryRun(submission.isDryRun())
                .plan(plan)
                .tokens(tokens)
                .ledger(ledger)
                .unitOfWork(submission.isDryRun() ? nestedTransaction : requiresNewTransaction)
                .build();
        AtomicInteger processed = new AtomicInteger();

        try {
            if (submission.isDryRun()) {
                requiredTransaction.executeWithoutResult(status -> {
                    processAll(submission, context, instances, processed, false);
                    status.setRollbackOnly();
                });
                log.info("Dry run of submission #{} rolled back", submission.getId());
            } else {
                processAll(submission, context, instances, processed, true);
            }
        } catch (RuntimeException e) {
            log.error("💥 Submission #{} failed: {}", submission.getId(), e.getMessage(), e);
            submission.setErrors(e.getMessage());
        } finally {
            ledger.flush();
        }

        finish(submission, ledger, processed.get());
        logSummary(submission, System.currentTimeMillis() - startTime);
        return submission;
    }

    // ================================
    // ROW PROCESSING
    // ================================

    private void processAll(Submission submission, ProcessingContext context,
                            Map<String, List<RowInstance>> instances, AtomicInteger processed, boolean parallel) {
        for (String entityType : context.getPlan().getOrder()) {
            List<RowInstance> rows = instances.get(entityType);
            if (rows.isEmpty()) continue;

            boolean inRowOrder = !parallel || context.getPlan().isSequential(entityType)
                    || hasContendedKeys(rows, context.getPlan().getMapping());
            log.info("📋 Processing {} {} row(s) of submission #{}{}", rows.size(), entityType,
                    submission.getId(), inRowOrder ? " in row order" : "");

            if (inRowOrder) {
                for (RowInstance row : rows) {
                    processOne(submission, context, row, processed);
                }
            } else {
                List<Future<?>> futures = new ArrayList<>();
                for (RowInstance row : rows) {
                    futures.add(rowExecutor.submit(() -> processOne(submission, context, row, processed)));
                }
                awaitAll(futures);
            }
        }
    }

    private void processOne(Submission submission, ProcessingContext context, RowInstance row,
                            AtomicInteger processed) {
        if (cancellationRegistry.isCancelled(submission.getId())) {
            context.getLedger().record(rowProcessor.skipped(row));
        } else {
            rowProcessor.process(row, context);
        }

        int done = processed.incrementAndGet();
        if (done % PROGRESS_INTERVAL == 0) {
            requiresNewTransaction.executeWithoutResult(status ->
                    submissionRepository.updateProgress(submission.getId(), done));
        }
    }

    /**
     * Waits for every row of the type, then reports the first worker failure with the others suppressed
     */
    static void awaitAll(List<Future<?>> futures) {
        BulkImportException failure = null;
        boolean interrupted = false;
        for (Future<?> future : futures) {
            while (true) {
                try {
                    future.get();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                } catch (ExecutionException e) {
                    if (failure == null) {
                        failure = new BulkImportException("Row worker failed: " + e.getCause().getMessage(),
                                e.getCause());
                    } else {
                        failure.addSuppressed(e.getCause());
                    }
                    break;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
            if (failure == null) {
                failure = new BulkImportException("Interrupted while waiting for rows");
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Rows of one type that share an external ID or natural value have to run in row order
     * so that the first of them is the one that creates it
     */
    private boolean hasContendedKeys(List<RowInstance> rows, ColumnMapping mapping) {
        Set<String> seen = new HashSet<>();
        for (RowInstance row : rows) {
            for (String key : rowProcessor.lockKeys(row, mapping)) {
                if (!seen.add(key)) return true;
            }
        }
        return false;
    }

    // ================================
    // PREPARATION
    // ================================

    private Map<String, List<RowInstance>> buildInstances(ParsedSheet sheet, ImportPlan plan) {
        Map<String, List<RowInstance>> instances = new LinkedHashMap<>();
        for (String entityType : plan.getOrder()) {
            List<ColumnSpec> columns = plan.getMapping().columnsFor(entityType);
            List<RowInstance> rows = new ArrayList<>();
            for (SheetRow row : sheet.getRows()) {
                boolean present = columns.stream().anyMatch(c -> row.cell(c.getIndex()) != null);
                if (present) {
                    rows.add(new RowInstance(row, entityType));
                }
            }
            instances.put(entityType, rows);
        }
        return instances;
    }

    private void declareTokens(ImportPlan plan, Map<String, List<RowInstance>> instances, TokenRegistry tokens) {
        for (String entityType : plan.getOrder()) {
            plan.getMapping().ownColumn(entityType, ColumnRole.OWN_TOKEN).ifPresent(column -> {
                for (RowInstance row : instances.get(entityType)) {
                    String token = row.cell(column.getIndex());
                    if (token != null) {
                        tokens.declare(entityType, token, row.getRowNumber())
                                .ifPresent(problem -> row.getPreErrors().add(column.getHeader() + ": " + problem));
                    }
                }
            });
        }
    }

    // ================================
    // COMPLETION
    // ================================

    private void finish(Submission submission, SubmissionLedger ledger, int processed) {
        boolean cancelled = cancellationRegistry.isCancelled(submission.getId());
        boolean failed = ledger.getRowErrors() > 0 || submission.getErrors() != null;

        SubmissionStatus status;
        if (cancelled) {
            status = SubmissionStatus.CANCELLED;
        } else if (submission.isDryRun()) {
            status = failed ? SubmissionStatus.VALIDATION_FAILED : SubmissionStatus.VALIDATING;
        } else if (!failed) {
            status = SubmissionStatus.COMMITTED;
        } else if (ledger.getRowCommits() > 0) {
            status = SubmissionStatus.PARTIALLY_COMMITTED;
        } else {
            status = SubmissionStatus.VALIDATION_FAILED;
        }

        submission.setStatus(status);
        submission.setCounts(ledger.getCounts());
        submission.setProcessedRows(processed);
        submission.setCompletedAt(LocalDateTime.now());
        save(submission);
        cancellationRegistry.clear(submission.getId());
    }

    private void save(Submission submission) {
        requiresNewTransaction.executeWithoutResult(status -> submissionRepository.update(submission));
    }

    private void logSummary(Submission submission, long durationMs) {
        log.info("╔════════════════════════════════════════════════════════════╗");
        log.info("║   SUBMISSION #{} {} in {}", submission.getId(), submission.getStatus(),
                Duration.ofMillis(durationMs));
        log.info("╚════════════════════════════════════════════════════════════╝");
        submission.getCounts().forEach((type, counts) ->
                log.info("   {} - created: {}, updated: {}, errored: {}, skipped: {}",
                        type, counts.getCreated(), counts.getUpdated(), counts.getErrored(), counts.getSkipped()));
        if (submission.getErrors() != null) {
            log.error("   Errors: {}", submission.getErrors());
        }
    }
}

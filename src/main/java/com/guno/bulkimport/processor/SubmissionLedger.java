package com.guno.bulkimport.processor;

import com.guno.bulkimport.dto.EntityCounts;
import com.guno.bulkimport.entity.OutcomeOrigin;
import com.guno.bulkimport.entity.RowOutcome;
import com.guno.bulkimport.repository.RowOutcomeRepository;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome ledger of one running submission. Assigns commit sequence numbers and keeps counts.
 * Commit runs write each outcome as soon as it is recorded; dry runs buffer them until {@link #flush()}.
 */
@Slf4j
public class SubmissionLedger {

    private final long submissionId;
    private final boolean dryRun;
    private final RowOutcomeRepository rowOutcomeRepository;

    private final List<RowOutcome> buffered = new ArrayList<>();
    private final Map<String, EntityCounts> counts = new LinkedHashMap<>();
    private long sequence;
    private int rowErrors;
    private int rowCommits;
    private int recorded;

    public SubmissionLedger(long submissionId, boolean dryRun, RowOutcomeRepository rowOutcomeRepository,
                            List<String> entityOrder) {
        this.submissionId = submissionId;
        this.dryRun = dryRun;
        this.rowOutcomeRepository = rowOutcomeRepository;
        entityOrder.forEach(type -> counts.put(type, new EntityCounts()));
    }

    public synchronized RowOutcome record(RowOutcome outcome) {
        outcome.setSubmissionId(submissionId);
        outcome.setSequence(++sequence);

        counts.computeIfAbsent(outcome.getEntityType(), k -> new EntityCounts()).add(outcome.getAction());
        if (outcome.getOrigin() == OutcomeOrigin.ROW) {
            if (outcome.isErrored()) rowErrors++;
            if (outcome.isCreated() || outcome.isUpdated()) rowCommits++;
        }

        if (dryRun) {
            buffered.add(outcome);
        } else {
            rowOutcomeRepository.insert(outcome);
        }
        recorded++;
        return outcome;
    }

    /**
     * Write buffered dry-run outcomes; called once the dry-run transaction has been rolled back
     */
    public synchronized void flush() {
        if (buffered.isEmpty()) return;
        int written = rowOutcomeRepository.insertAll(buffered);
        log.debug("Flushed {} buffered outcomes of submission #{}", written, submissionId);
        buffered.clear();
    }

    public synchronized Map<String, EntityCounts> getCounts() {
        Map<String, EntityCounts> copy = new LinkedHashMap<>();
        counts.forEach((type, c) -> copy.put(type, EntityCounts.builder()
                .created(c.getCreated())
                .updated(c.getUpdated())
                .errored(c.getErrored())
                .skipped(c.getSkipped())
                .build()));
        return copy;
    }

    public synchronized int getRowErrors() {
        return rowErrors;
    }

    public synchronized int getRowCommits() {
        return rowCommits;
    }

    public synchronized int getRecorded() {
        return recorded;
    }
}

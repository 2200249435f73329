package com.guno.bulkimport.service;

import com.guno.bulkimport.config.ImportProperties;
import com.guno.bulkimport.entity.RowOutcome;
import com.guno.bulkimport.entity.Submission;
import com.guno.bulkimport.entity.SubmissionStatus;
import com.guno.bulkimport.exception.ReversalRefusedException;
import com.guno.bulkimport.exception.SubmissionNotFoundException;
import com.guno.bulkimport.repository.EntityStore;
import com.guno.bulkimport.repository.ExternalIdRepository;
import com.guno.bulkimport.repository.RowOutcomeRepository;
import com.guno.bulkimport.repository.SubmissionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Comparator;
import java.util.List;

/**
 * Reversal Service - deletes everything a committed submission created, newest first, in one transaction
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReversalService {

    private final SubmissionRepository submissionRepository;
    private final RowOutcomeRepository rowOutcomeRepository;
    private final ExternalIdRepository externalIdRepository;
    private final EntityStore entityStore;
    private final ImportProperties properties;

    @Qualifier("requiresNewTransaction")
    private final TransactionTemplate requiresNewTransaction;

    public ReversalResult reverse(long submissionId) {
        Submission submission = submissionRepository.findById(submissionId)
                .orElseThrow(() -> new SubmissionNotFoundException(submissionId));
        checkReversible(submission);

        List<RowOutcome> outcomes = rowOutcomeRepository.findBySubmission(submissionId);
        List<RowOutcome> updates = outcomes.stream()
                .filter(RowOutcome::isUpdated)
                .toList();
        if (!updates.isEmpty() && properties.getReversal().getPolicy() == ImportProperties.ReversalPolicy.REFUSE) {
            throw new ReversalRefusedException(submissionId, updates.size()
                    + " existing record(s) were updated and cannot be restored");
        }

        List<RowOutcome> creations = outcomes.stream()
                .filter(RowOutcome::isCreated)
                .sorted(Comparator.comparingLong(RowOutcome::getSequence).reversed())
                .toList();

        log.info("↩️ Reversing submission #{} - {} creation(s), {} update(s) left in place",
                submissionId, creations.size(), updates.size());

        try {
            ReversalResult result = requiresNewTransaction.execute(status -> {
                ReversalResult r = ReversalResult.builder()
                        .submissionId(submissionId)
                        .updatesLeftInPlace(updates.size())
                        .build();

                for (RowOutcome created : creations) {
                    r.setMappingsRemoved(r.getMappingsRemoved()
                            + externalIdRepository.deleteByInstance(created.getEntityType(), created.getInstanceId()));
                    if (!entityStore.exists(created.getEntityType(), created.getInstanceId())) {
                        log.warn("{} #{} is already gone", created.getEntityType(), created.getInstanceId());
                        continue;
                    }
                    entityStore.delete(created.getEntityType(), created.getInstanceId());
                    r.setDeleted(r.getDeleted() + 1);
                    r.getDeletedByType().merge(created.getEntityType(), 1, Integer::sum);
                }

                submission.setStatus(SubmissionStatus.REVERSED);
                submissionRepository.update(submission);
                return r;
            });

            log.info("✅ Submission #{} reversed - deleted: {}, external IDs removed: {}",
                    submissionId, result.getDeleted(), result.getMappingsRemoved());
            return result;

        } catch (DataIntegrityViolationException e) {
            log.warn("❌ Reversal of submission #{} rolled back: {}", submissionId, e.getMostSpecificCause().getMessage());
            throw new ReversalRefusedException(submissionId,
                    "records it created are still referenced elsewhere (" + e.getMostSpecificCause().getMessage() + ")");
        }
    }

    private void checkReversible(Submission submission) {
        long id = submission.getId();
        if (submission.isDryRun()) {
            throw new ReversalRefusedException(id, "it was a dry run and wrote nothing");
        }
        if (submission.getStatus() == SubmissionStatus.REVERSED) {
            throw new ReversalRefusedException(id, "it has already been reversed");
        }
        if (submission.getStatus() == SubmissionStatus.PLANNING_FAILED) {
            throw new ReversalRefusedException(id, "it failed planning and wrote nothing");
        }
        if (!submission.isCompleted()) {
            throw new ReversalRefusedException(id, "it is still " + submission.getStatus());
        }
        // A commit in which every row failed may still have left stubs behind
        if (!submission.getStatus().isReversible() && submission.getStatus() != SubmissionStatus.VALIDATION_FAILED) {
            throw new ReversalRefusedException(id, "it ended " + submission.getStatus());
        }
    }
}

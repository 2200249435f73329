package com.guno.bulkimport.exception;

import lombok.Getter;

/**
 * Returned instead of performing a reversal; nothing was deleted
 */
@Getter
public class ReversalRefusedException extends BulkImportException {

    private final Long submissionId;

    public ReversalRefusedException(Long submissionId, String reason) {
        super("Submission " + submissionId + " cannot be reversed: " + reason);
        this.submissionId = submissionId;
    }
}

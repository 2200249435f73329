package com.guno.bulkimport.exception;

public class SubmissionNotFoundException extends BulkImportException {

    public SubmissionNotFoundException(Long submissionId) {
        super("Submission " + submissionId + " does not exist");
    }
}

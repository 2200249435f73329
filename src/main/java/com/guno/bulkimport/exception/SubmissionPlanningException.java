package com.guno.bulkimport.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised before any write when the submission as a whole cannot be processed:
 * malformed or unknown headers, forbidden columns, dependency cycles.
 */
@Getter
public class SubmissionPlanningException extends BulkImportException {

    private final List<String> problems;

    public SubmissionPlanningException(String message) {
        super(message);
        this.problems = List.of(message);
    }

    public SubmissionPlanningException(List<String> problems) {
        super(String.join(" ", problems));
        this.problems = List.copyOf(problems);
    }
}

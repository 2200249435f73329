package com.guno.bulkimport.entity;

/**
 * Submission lifecycle:
 * CREATED -> PLANNING -> {PLANNING_FAILED | VALIDATING} -> {VALIDATION_FAILED | COMMITTING}
 * -> {COMMITTED | PARTIALLY_COMMITTED}, plus CANCELLED and REVERSED.
 * Dry runs stop at VALIDATING or VALIDATION_FAILED.
 */
public enum SubmissionStatus {
    CREATED,
    PLANNING,
    PLANNING_FAILED,
    VALIDATING,
    VALIDATION_FAILED,
    COMMITTING,
    COMMITTED,
    PARTIALLY_COMMITTED,
    CANCELLED,
    REVERSED;

    public boolean isReversible() {
        return this == COMMITTED || this == PARTIALLY_COMMITTED || this == CANCELLED;
    }
}

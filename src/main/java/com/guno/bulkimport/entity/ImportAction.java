package com.guno.bulkimport.entity;

/**
 * Requested action for a submission
 */
public enum ImportAction {
    CREATE,
    UPDATE,
    REVERSE;

    /** Only CREATE submissions may create missing reference targets */
    public boolean permitsCreation() {
        return this == CREATE;
    }
}

package com.guno.bulkimport.exception;

/**
 * Store-level failure of a single row, carrying the store's own message
 */
public class RowPersistenceException extends BulkImportException {

    public RowPersistenceException(String message) {
        super(message);
    }

    public RowPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}

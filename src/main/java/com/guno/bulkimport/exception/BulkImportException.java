package com.guno.bulkimport.exception;

/**
 * Base class for every error raised by the bulk import engine
 */
public class BulkImportException extends RuntimeException {

    public BulkImportException(String message) {
        super(message);
    }

    public BulkImportException(String message, Throwable cause) {
        super(message, cause);
    }
}

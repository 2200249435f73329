package com.guno.bulkimport.exception;

import lombok.Getter;

import java.util.List;

/**
 * Field-level or reference-resolution failure of a single row
 */
@Getter
public class RowValidationException extends BulkImportException {

    private final List<String> errors;

    public RowValidationException(String message) {
        super(message);
        this.errors = List.of(message);
    }

    public RowValidationException(List<String> errors) {
        super(String.join(" ", errors));
        this.errors = List.copyOf(errors);
    }
}

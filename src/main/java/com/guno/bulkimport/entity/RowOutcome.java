package com.guno.bulkimport.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Row Outcome Entity - Maps to import_row_outcome table, written once per row instance
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RowOutcome {

    private Long id;
    private Long submissionId;
    private int rowNumber;
    private String entityType;
    @Builder.Default private OutcomeOrigin origin = OutcomeOrigin.ROW;
    private OutcomeAction action;
    private Long instanceId;
    @Builder.Default private List<String> errors = new ArrayList<>();
    private long sequence;

    public boolean isCreated() {
        return action == OutcomeAction.CREATED;
    }

    public boolean isUpdated() {
        return action == OutcomeAction.UPDATED;
    }

    public boolean isErrored() {
        return action == OutcomeAction.ERRORED;
    }

    public String getErrorText() {
        return String.join(" ", errors);
    }
}

package com.guno.bulkimport.service;

import com.guno.bulkimport.dto.EntityCounts;
import com.guno.bulkimport.entity.OutcomeAction;
import com.guno.bulkimport.entity.OutcomeOrigin;
import com.guno.bulkimport.entity.RowOutcome;
import com.guno.bulkimport.entity.Submission;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Import Report - a submission with its outcomes in report order and per-entity-type counts
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportReport {

    private Submission submission;
    @Builder.Default private Map<String, EntityCounts> counts = new LinkedHashMap<>();
    @Builder.Default private List<RowOutcome> outcomes = new ArrayList<>();

    public List<RowOutcome> getErrors() {
        return outcomes.stream().filter(RowOutcome::isErrored).toList();
    }

    public List<RowOutcome> rowOutcomes(String entityType) {
        return outcomes.stream()
                .filter(o -> o.getOrigin() == OutcomeOrigin.ROW && o.getEntityType().equals(entityType))
                .toList();
    }

    public long count(OutcomeAction action) {
        return outcomes.stream().filter(o -> o.getAction() == action).count();
    }

    public EntityCounts countsFor(String entityType) {
        return counts.getOrDefault(entityType, new EntityCounts());
    }
}

package com.guno.bulkimport.planner;

import com.guno.bulkimport.entity.ImportAction;
import com.guno.bulkimport.mapper.ColumnMapping;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Import Plan - decoded columns plus the order in which entity types are processed
 */
@Data
@Builder
@AllArgsConstructor
public class ImportPlan {

    private ImportAction action;
    private ColumnMapping mapping;

    /** Entity types, every type after all of the types it references */
    private List<String> order;

    /** entity type -> entity types its columns reference, self edges included */
    private Map<String, Set<String>> dependencies;

    /** Types with a same-type token reference, processed one row at a time */
    private Set<String> sequentialTypes;

    public boolean isSequential(String entityType) {
        return sequentialTypes.contains(entityType);
    }
}

package com.guno.bulkimport.mapper;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Column Mapping - every header of a submission decoded and grouped by entity type in header order
 */
@Getter
public class ColumnMapping {

    private final List<ColumnSpec> columns;
    private final Map<String, List<ColumnSpec>> columnsByEntity;

    public ColumnMapping(List<ColumnSpec> columns) {
        this.columns = List.copyOf(columns);
        Map<String, List<ColumnSpec>> grouped = new LinkedHashMap<>();
        for (ColumnSpec column : columns) {
            grouped.computeIfAbsent(column.getEntityType(), k -> new ArrayList<>()).add(column);
        }
        grouped.replaceAll((k, v) -> List.copyOf(v));
        this.columnsByEntity = Collections.unmodifiableMap(grouped);
    }

    /** Entity types in order of first appearance */
    public List<String> getEntityTypes() {
        return List.copyOf(columnsByEntity.keySet());
    }

    public List<ColumnSpec> columnsFor(String entityType) {
        return columnsByEntity.getOrDefault(entityType, List.of());
    }

    public Optional<ColumnSpec> ownColumn(String entityType, ColumnRole role) {
        return columnsFor(entityType).stream().filter(c -> c.getRole() == role).findFirst();
    }

    public boolean hasOwnColumn(String entityType, ColumnRole role) {
        return ownColumn(entityType, role).isPresent();
    }

    public List<ColumnSpec> fieldColumns(String entityType) {
        return columnsFor(entityType).stream().filter(c -> c.getRole() == ColumnRole.FIELD).toList();
    }

    public int headerPosition(String entityType) {
        return getEntityTypes().indexOf(entityType);
    }
}

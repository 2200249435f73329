package com.guno.bulkimport.sheet;

import lombok.Getter;

import java.util.List;

/**
 * One data row of a submission; row numbers start at 1 for the first row after the headers
 */
@Getter
public class SheetRow {

    private final int rowNumber;
    private final List<String> cells;

    public SheetRow(int rowNumber, List<String> cells) {
        this.rowNumber = rowNumber;
        this.cells = List.copyOf(cells);
    }

    /**
     * Trimmed cell value, or null when the cell is blank or missing
     */
    public String cell(int columnIndex) {
        if (columnIndex >= cells.size()) return null;
        String value = cells.get(columnIndex);
        return value == null || value.isBlank() ? null : value.trim();
    }

    public boolean isBlank() {
        return cells.stream().allMatch(c -> c == null || c.isBlank());
    }
}

package com.guno.bulkimport.processor;

import com.guno.bulkimport.sheet.SheetRow;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * The part of one sheet row that defines an instance of one entity type
 */
@Getter
public class RowInstance {

    private final SheetRow row;
    private final String entityType;

    /** Problems found before processing, such as a token already declared by another row */
    private final List<String> preErrors = new ArrayList<>();

    public RowInstance(SheetRow row, String entityType) {
        this.row = row;
        this.entityType = entityType;
    }

    public int getRowNumber() {
        return row.getRowNumber();
    }

    public String cell(int columnIndex) {
        return row.cell(columnIndex);
    }
}

package com.guno.bulkimport.sheet;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Headers and ordered data rows of an uploaded file
 */
@Getter
@AllArgsConstructor
public class ParsedSheet {

    private final String fileName;
    private final List<String> headers;
    private final List<SheetRow> rows;

    public int getRowCount() {
        return rows.size();
    }
}

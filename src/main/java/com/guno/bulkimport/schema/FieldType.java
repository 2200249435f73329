package com.guno.bulkimport.schema;

/**
 * Value categories a template column can carry
 */
public enum FieldType {
    BOOLEAN,
    INTEGER,
    DECIMAL,
    STRING,
    DATE,
    DATETIME,
    JSON,
    RELATION;

    public boolean isRelation() {
        return this == RELATION;
    }
}

package com.guno.bulkimport.mapper;

import com.guno.bulkimport.schema.FieldDef;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Decoded header of one column
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnSpec {

    private int index;
    private String header;
    private String entityType;
    private ColumnRole role;
    private ResolutionKind kind;

    /** Null for the own id, external_id and token columns */
    private FieldDef field;

    public boolean isReference() {
        return role == ColumnRole.FIELD && kind.isReference();
    }

    /** Entity type a reference column points at, null for everything else */
    public String getTargetType() {
        return isReference() ? field.getTarget() : null;
    }

    public boolean isSelfReference() {
        return isReference() && entityType.equals(field.getTarget());
    }
}

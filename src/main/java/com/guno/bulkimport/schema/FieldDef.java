package com.guno.bulkimport.schema;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Field declaration - one importable attribute of an entity type
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldDef {

    private String name;
    private String column;
    private FieldType type;

    @Builder.Default
    private boolean required = false;

    private Integer maxLength;

    /** Target entity type, only set for RELATION fields */
    private String target;

    public boolean isRelation() {
        return type != null && type.isRelation();
    }

    public static FieldDef of(String name, FieldType type) {
        return FieldDef.builder().name(name).column(name).type(type).build();
    }

    public static FieldDef required(String name, FieldType type) {
        return FieldDef.builder().name(name).column(name).type(type).required(true).build();
    }

    public static FieldDef string(String name, int maxLength, boolean required) {
        return FieldDef.builder()
                .name(name)
                .column(name)
                .type(FieldType.STRING)
                .maxLength(maxLength)
                .required(required)
                .build();
    }

    public static FieldDef relation(String name, String column, String target, boolean required) {
        return FieldDef.builder()
                .name(name)
                .column(column)
                .type(FieldType.RELATION)
                .target(target)
                .required(required)
                .build();
    }
}

package com.guno.bulkimport.mapper;

/**
 * How the cell of a column becomes a stored value
 */
public enum ResolutionKind {
    DIRECT_VALUE(null),
    PRIMARY_KEY_REFERENCE("pk"),
    EXTERNAL_ID_REFERENCE("externalid"),
    NATURAL_VALUE_REFERENCE(null),
    IMPLICIT_TOKEN_REFERENCE("token");

    private final String suffix;

    ResolutionKind(String suffix) {
        this.suffix = suffix;
    }

    public String getSuffix() {
        return suffix;
    }

    public boolean isReference() {
        return this != DIRECT_VALUE;
    }

    public static ResolutionKind fromSuffix(String suffix) {
        for (ResolutionKind kind : values()) {
            if (kind.suffix != null && kind.suffix.equalsIgnoreCase(suffix)) {
                return kind;
            }
        }
        return null;
    }
}

package com.guno.bulkimport.mapper;

/**
 * What a column contributes to its entity instance
 */
public enum ColumnRole {
    /** A field value or a reference to another instance */
    FIELD,
    /** {@code Entity.id}: primary key of the instance to update */
    OWN_PRIMARY_KEY,
    /** {@code Entity.external_id}: external identifier of the instance */
    OWN_EXTERNAL_ID,
    /** {@code Entity.token}: token other rows of this submission may point at */
    OWN_TOKEN
}

package com.guno.bulkimport.entity;

/**
 * ROW: the instance a row defines for an entity type.
 * REFERENCE: an instance auto-created while resolving one of that row's references.
 */
public enum OutcomeOrigin {
    ROW,
    REFERENCE
}

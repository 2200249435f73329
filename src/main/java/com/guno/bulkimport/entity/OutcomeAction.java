package com.guno.bulkimport.entity;

public enum OutcomeAction {
    CREATED,
    UPDATED,
    ERRORED,
    SKIPPED
}

package com.guno.bulkimport.processor;

import com.guno.bulkimport.exception.RowValidationException;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Implicit-reference tokens of one submission: (entity type, token) -> declaring row and, once processed, its id.
 * Never persisted.
 */
public class TokenRegistry {

    enum State { PENDING, RESOLVED, FAILED }

    private static final class Entry {
        private final int rowNumber;
        private volatile State state = State.PENDING;
        private volatile Long instanceId;

        private Entry(int rowNumber) {
            this.rowNumber = rowNumber;
        }
    }

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    /**
     * Declare a token for a row. Returns an error when another row already declared it.
     */
    public Optional<String> declare(String entityType, String token, int rowNumber) {
        Entry existing = entries.putIfAbsent(key(entityType, token), new Entry(rowNumber));
        if (existing != null && existing.rowNumber != rowNumber) {
            return Optional.of(entityType + " token '" + token + "' is already used by row " + existing.rowNumber + ".");
        }
        return Optional.empty();
    }

    public boolean isDeclaredBy(String entityType, String token, int rowNumber) {
        Entry entry = entries.get(key(entityType, token));
        return entry != null && entry.rowNumber == rowNumber;
    }

    public long resolve(String header, String entityType, String token, int referencingRow) {
        Entry entry = entries.get(key(entityType, token));
        if (entry == null) {
            throw new RowValidationException(header + ": no row declares " + entityType + " token '" + token + "'.");
        }
        return switch (entry.state) {
            case RESOLVED -> entry.instanceId;
            case FAILED -> throw new RowValidationException(header + ": " + entityType + " token '" + token
                    + "' belongs to row " + entry.rowNumber + ", which failed.");
            case PENDING -> throw new RowValidationException(entry.rowNumber == referencingRow
                    ? header + ": " + entityType + " token '" + token + "' refers to this same row."
                    : header + ": " + entityType + " token '" + token + "' refers to row " + entry.rowNumber
                    + ", which has not been processed yet.");
        };
    }

    public void resolved(String entityType, String token, long instanceId) {
        Entry entry = entries.get(key(entityType, token));
        if (entry != null) {
            entry.instanceId = instanceId;
            entry.state = State.RESOLVED;
        }
    }

    public void failed(String entityType, String token) {
        Entry entry = entries.get(key(entityType, token));
        if (entry != null) {
            entry.state = State.FAILED;
        }
    }

    private static String key(String entityType, String token) {
        return entityType + "|" + token;
    }
}

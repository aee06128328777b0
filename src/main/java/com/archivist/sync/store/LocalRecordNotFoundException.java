package com.archivist.sync.store;

/**
 * Thrown by store writes that address a record id the store does not hold.
 */
public class LocalRecordNotFoundException extends RuntimeException {

    private final String recordId;

    public LocalRecordNotFoundException(String recordId) {
        super("Local record not found: " + recordId);
        this.recordId = recordId;
    }

    public String getRecordId() {
        return recordId;
    }
}

package com.archivist.sync.plan;

/**
 * Thrown when a plan is executed while another execution is still running.
 */
public class SyncInProgressException extends RuntimeException {

    public SyncInProgressException(String message) {
        super(message);
    }
}

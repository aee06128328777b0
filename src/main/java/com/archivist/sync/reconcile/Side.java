package com.archivist.sync.reconcile;

/**
 * The two stores being reconciled.
 */
public enum Side {
    REMOTE,
    LOCAL;

    public Side opposite() {
        return this == REMOTE ? LOCAL : REMOTE;
    }
}

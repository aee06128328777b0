package com.archivist.sync.plan;

@FunctionalInterface
public interface SyncProgressListener {

    SyncProgressListener NOOP = progress -> {
    };

    void onProgress(SyncProgress progress);
}

package com.archivist.sync.plan;

public enum JobOutcome {
    DONE,
    SKIPPED,
    FAILED
}

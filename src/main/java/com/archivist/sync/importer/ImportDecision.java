package com.archivist.sync.importer;

/**
 * What the importer did with a mapped entity.
 */
public enum ImportDecision {
    /** Score at or above the auto-import threshold; upserted. */
    AUTO_IMPORTED,
    /** Score between the review and auto-import thresholds; queued for review. */
    QUEUED,
    /** Score below the review threshold or excluded by a correction. */
    DROPPED,
    /** Fingerprint unchanged since the last upsert. */
    UNCHANGED,
    /** Upsert attempted and failed. */
    FAILED
}

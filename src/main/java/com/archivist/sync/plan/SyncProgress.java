package com.archivist.sync.plan;

/**
 * Progress snapshot emitted after every job.
 *
 * @param phase       phase of the job just processed; null before the first job
 * @param currentName name of the job just processed; null before the first job
 */
public record SyncProgress(int processed, int total, JobType phase, String currentName) {

    public double fraction() {
        return total == 0 ? 1.0 : (double) processed / total;
    }
}

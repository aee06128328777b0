package com.archivist.sync.plan;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a plan execution.
 *
 * @param processed   jobs processed, equal to {@code total} once execution finished
 * @param done        jobs that changed something
 * @param skipped     jobs with nothing to do, including jobs whose local record was missing
 * @param failedJobs  jobs that failed, in execution order
 */
public record SyncReport(
        SyncPlan plan,
        int total,
        int processed,
        int done,
        int skipped,
        List<FailedJob> failedJobs,
        Duration duration
) {
    public SyncReport {
        failedJobs = failedJobs != null ? List.copyOf(failedJobs) : List.of();
    }

    public enum FailureKind {
        /** The remote service rejected the description length. */
        DESCRIPTION_TOO_LONG,
        /** Transport error or non-success response from the remote service. */
        REMOTE_SERVICE,
        /** The local store refused the write. */
        LOCAL_STORE,
        UNEXPECTED
    }

    public record FailedJob(SyncJob job, FailureKind kind, String message) {
    }

    public String planId() {
        return plan.getId();
    }

    public int failureCount() {
        return failedJobs.size();
    }

    public boolean isComplete() {
        return failedJobs.isEmpty();
    }
}

package com.archivist.sync.plan;

import java.util.Objects;

/**
 * A single unit of plan execution.
 *
 * @param localId  the local record the job reads or writes; null for jobs creating local records
 * @param remoteId the remote entity or session; null for export jobs
 */
public record SyncJob(JobType type, SyncJobKind kind, String name, String localId, String remoteId) {

    public SyncJob {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(kind, "kind is required");
        name = name != null ? name : "";
    }

    public static SyncJob createLocal(SyncJobKind kind, String name, String remoteId) {
        return new SyncJob(JobType.CREATE_LOCAL, kind, name, null, Objects.requireNonNull(remoteId, "remoteId"));
    }

    public static SyncJob importRemote(SyncJobKind kind, String name, String remoteId) {
        return new SyncJob(JobType.IMPORT, kind, name, null, Objects.requireNonNull(remoteId, "remoteId"));
    }

    public static SyncJob recap(String title, String sessionId) {
        return new SyncJob(JobType.RECAP, SyncJobKind.RECAP, title, null, Objects.requireNonNull(sessionId, "sessionId"));
    }

    public static SyncJob link(SyncJobKind kind, String name, String localId, String remoteId) {
        return new SyncJob(JobType.LINK, kind, name,
                Objects.requireNonNull(localId, "localId"), Objects.requireNonNull(remoteId, "remoteId"));
    }

    public static SyncJob export(SyncJobKind kind, String name, String localId) {
        return new SyncJob(JobType.EXPORT, kind, name, Objects.requireNonNull(localId, "localId"), null);
    }
}

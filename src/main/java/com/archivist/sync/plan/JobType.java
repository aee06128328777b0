package com.archivist.sync.plan;

/**
 * Phases of plan execution, in execution order.
 */
public enum JobType {
    /** Create a local record for a remote-only entity the user opted into. */
    CREATE_LOCAL,
    /** Import a remote-only entity as a local reference sheet. */
    IMPORT,
    /** Create or refresh a recap sheet from a dated session. */
    RECAP,
    /** Bind an existing local record to its matched remote entity. */
    LINK,
    /** Create a remote record for a local-only record. */
    EXPORT
}

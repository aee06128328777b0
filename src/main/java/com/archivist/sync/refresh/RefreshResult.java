package com.archivist.sync.refresh;

/**
 * What a refresh changed locally.
 *
 * @param linksSkipped remote links whose endpoints have no local sheet
 */
public record RefreshResult(
        int sheetsCreated,
        int sheetsUpdated,
        int recapsCreated,
        int recapsUpdated,
        int parentsUpdated,
        int linksApplied,
        int linksSkipped
) {
}

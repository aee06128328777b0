package com.archivist.sync.importer;

/**
 * Counters of an importer run. Emitted after every entity and once at the end.
 *
 * @param completed entities handled so far
 * @param unchanged entities skipped because their fingerprint matched the last import
 */
public record ImportSummary(
        int total,
        int completed,
        int autoImported,
        int queued,
        int dropped,
        int unchanged,
        int errors
) {
    public static ImportSummary start(int total) {
        return new ImportSummary(total, 0, 0, 0, 0, 0, 0);
    }

    public ImportSummary record(ImportDecision decision) {
        return new ImportSummary(total, completed + 1,
                autoImported + (decision == ImportDecision.AUTO_IMPORTED ? 1 : 0),
                queued + (decision == ImportDecision.QUEUED ? 1 : 0),
                dropped + (decision == ImportDecision.DROPPED ? 1 : 0),
                unchanged + (decision == ImportDecision.UNCHANGED ? 1 : 0),
                errors + (decision == ImportDecision.FAILED ? 1 : 0));
    }

    public boolean isDone() {
        return completed == total;
    }
}

package com.archivist.sync.reconcile;

import com.archivist.sync.store.LocalRecord;

import java.util.Objects;

/**
 * A local record as offered to the reconciliation engine.
 *
 * @param type host subtype; for characters {@code character}, {@code npc}, {@code monster} or empty
 */
public record ReconciliationCandidate(String id, String name, String type, String image) {

    public ReconciliationCandidate {
        Objects.requireNonNull(id, "id is required");
        name = name != null ? name.trim() : "";
        type = type != null ? type.trim() : "";
    }

    public static ReconciliationCandidate of(LocalRecord record) {
        return new ReconciliationCandidate(record.getId(), record.getName(), record.getType(),
                record.getImage().orElse(null));
    }
}

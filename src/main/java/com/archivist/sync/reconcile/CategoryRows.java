package com.archivist.sync.reconcile;

import java.util.List;

/**
 * Both sides of one category, each sorted by name.
 */
public record CategoryRows(List<ReconciliationRow> remote, List<ReconciliationRow> local) {

    public CategoryRows {
        remote = remote != null ? List.copyOf(remote) : List.of();
        local = local != null ? List.copyOf(local) : List.of();
    }

    public List<ReconciliationRow> side(Side side) {
        return side == Side.REMOTE ? remote : local;
    }

    public long matchedCount() {
        return remote.stream().filter(ReconciliationRow::isMatched).count();
    }
}

package com.archivist.sync.reconcile;

import com.archivist.sync.remote.RemoteSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Paired rows per category, plus the edits a user makes before confirming a plan.
 *
 * <p>Matches are symmetric: when a row names a partner, the partner names it back. Every
 * operation here restores that before returning. Edits are expected from a single thread.</p>
 */
public class ReconciliationResult {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationResult.class);

    private final RemoteSnapshot remote;
    private final Map<Category, CategoryRows> categories;

    ReconciliationResult(RemoteSnapshot remote, Map<Category, CategoryRows> categories) {
        this.remote = Objects.requireNonNull(remote, "remote");
        this.categories = new EnumMap<>(Category.class);
        for (Category category : Category.values()) {
            this.categories.put(category, categories.getOrDefault(category, new CategoryRows(null, null)));
        }
    }

    /**
     * The remote snapshot this result was computed from.
     */
    public RemoteSnapshot getRemote() {
        return remote;
    }

    public CategoryRows get(Category category) {
        return categories.get(category);
    }

    public List<ReconciliationRow> rows(Category category, Side side) {
        return categories.get(category).side(side);
    }

    public Optional<ReconciliationRow> find(Category category, Side side, String id) {
        return rows(category, side).stream().filter(r -> r.getId().equals(id)).findFirst();
    }

    /**
     * Sets the selection of a row and of its matched counterpart.
     *
     * @throws IllegalArgumentException if the row does not exist
     */
    public void toggleSelected(Category category, Side side, String id, boolean selected) {
        ReconciliationRow row = require(category, side, id);
        row.setSelected(selected);
        if (row.getMatch() != null) {
            find(category, side.opposite(), row.getMatch()).ifPresent(partner -> partner.setSelected(selected));
        }
    }

    /**
     * Re-points the match of a row. Both the row's previous partner and the new partner's
     * previous partner lose their match before the new pair is linked.
     *
     * @param newMatchId id on the opposite side, or null to unmatch
     * @throws IllegalArgumentException if either row does not exist
     */
    public void changeMatch(Category category, Side side, String id, String newMatchId) {
        ReconciliationRow row = require(category, side, id);
        ReconciliationRow newPartner = newMatchId != null ? require(category, side.opposite(), newMatchId) : null;

        if (row.getMatch() != null) {
            find(category, side.opposite(), row.getMatch()).ifPresent(old -> old.setMatch(null));
            row.setMatch(null);
        }
        if (newPartner == null) {
            log.debug("reconcile.unmatched category={} side={} id={}", category, side, id);
            return;
        }
        if (newPartner.getMatch() != null) {
            find(category, side, newPartner.getMatch()).ifPresent(displaced -> displaced.setMatch(null));
        }
        row.setMatch(newPartner.getId());
        newPartner.setMatch(row.getId());
        log.debug("reconcile.rematched category={} side={} id={} match={}", category, side, id, newMatchId);
    }

    public void selectAll(Category category, Side side) {
        rows(category, side).forEach(r -> toggleSelected(category, side, r.getId(), true));
    }

    public void selectNone(Category category, Side side) {
        rows(category, side).forEach(r -> toggleSelected(category, side, r.getId(), false));
    }

    /**
     * @throws IllegalStateException naming the first row whose partner does not point back
     */
    public void verifySymmetry() {
        for (Category category : Category.values()) {
            for (Side side : Side.values()) {
                for (ReconciliationRow row : rows(category, side)) {
                    if (row.getMatch() == null) {
                        continue;
                    }
                    ReconciliationRow partner = find(category, side.opposite(), row.getMatch()).orElse(null);
                    if (partner == null || !row.getId().equals(partner.getMatch())) {
                        throw new IllegalStateException("Asymmetric match in " + category + ": "
                                + side + " row " + row.getId() + " -> " + row.getMatch());
                    }
                }
            }
        }
    }

    private ReconciliationRow require(Category category, Side side, String id) {
        return find(category, side, id).orElseThrow(() ->
                new IllegalArgumentException("No " + side + " row " + id + " in " + category));
    }
}

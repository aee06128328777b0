package com.archivist.sync.reconcile;

import com.archivist.sync.metrics.NoOpSyncMetrics;
import com.archivist.sync.metrics.SyncMetrics;
import com.archivist.sync.remote.RemoteEntity;
import com.archivist.sync.remote.RemoteSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Pairs remote and local entities of the same category by name.
 *
 * <p>Matching is greedy and one-to-one: remote rows are visited in input order and each
 * claims the first unclaimed local row with the same name (trimmed, case-insensitive) that
 * satisfies the category constraint. A second pass pairs rows still unmatched on both sides
 * by name alone. Output rows are sorted by name, then id. The same inputs always produce
 * the same result.</p>
 */
public class ReconciliationEngine {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private static final Set<String> UNTYPED = Set.of("", "base");
    private static final Set<String> NPC_TYPES = Set.of("npc", "monster");
    private static final Set<String> ACTOR_TYPES = Set.of("character", "npc", "monster");

    private static final Comparator<ReconciliationRow> BY_NAME = Comparator
            .comparing((ReconciliationRow r) -> r.getName().toLowerCase(Locale.ROOT))
            .thenComparing(ReconciliationRow::getId);

    private final SyncMetrics metrics;

    public ReconciliationEngine() {
        this(new NoOpSyncMetrics());
    }

    public ReconciliationEngine(SyncMetrics metrics) {
        this.metrics = metrics;
    }

    public ReconciliationResult reconcile(RemoteSnapshot remote, LocalSnapshot local) {
        Map<Category, CategoryRows> categories = new EnumMap<>(Category.class);
        categories.put(Category.CHARACTERS, reconcileCharacters(remote.characters(), local.characters()));
        categories.put(Category.ITEMS, pair(remoteRows(remote.items(), false), local.items(), false));
        categories.put(Category.LOCATIONS, pair(remoteRows(remote.locations(), false), local.locations(), false));
        categories.put(Category.FACTIONS, new CategoryRows(sorted(remoteRows(remote.factions(), false)), List.of()));

        categories.forEach((category, rows) -> {
            int matched = (int) rows.matchedCount();
            metrics.recordReconcileMatched(category, matched);
            log.debug("reconcile.category category={} remote={} local={} matched={}",
                    category, rows.remote().size(), rows.local().size(), matched);
        });
        return new ReconciliationResult(remote, categories);
    }

    private CategoryRows reconcileCharacters(List<RemoteEntity> remote, List<ReconciliationCandidate> local) {
        List<ReconciliationRow> remoteRows = remoteRows(remote, true);
        boolean typed = local.stream().anyMatch(c -> ACTOR_TYPES.contains(normalize(c.type())));
        if (typed) {
            return pair(remoteRows, local, true);
        }
        // Untyped actors are displayed with the type of the same-named remote character.
        Map<String, String> remoteTypeByName = new HashMap<>();
        for (RemoteEntity entity : remote) {
            remoteTypeByName.putIfAbsent(normalize(entity.name()), entity.characterType());
        }
        List<ReconciliationCandidate> classified = new ArrayList<>(local.size());
        for (ReconciliationCandidate candidate : local) {
            String remoteType = remoteTypeByName.getOrDefault(normalize(candidate.name()), RemoteEntity.NPC);
            String displayType = RemoteEntity.PC.equals(remoteType) ? "character" : "npc";
            classified.add(new ReconciliationCandidate(candidate.id(), candidate.name(), displayType, candidate.image()));
        }
        CategoryRows rows = pair(remoteRows, local, true);
        return new CategoryRows(rows.remote(), relabel(rows.local(), classified));
    }

    private CategoryRows pair(List<ReconciliationRow> remoteRows, List<ReconciliationCandidate> local,
                              boolean characterConstraint) {
        List<ReconciliationRow> localRows = new ArrayList<>(local.size());
        for (ReconciliationCandidate candidate : local) {
            localRows.add(new ReconciliationRow(candidate.id(), candidate.name(), candidate.type(), candidate.image()));
        }

        for (ReconciliationRow remote : remoteRows) {
            for (ReconciliationRow row : localRows) {
                if (row.getMatch() == null && sameName(remote, row)
                        && (!characterConstraint || typeAllows(remote.getType(), row.getType()))) {
                    link(remote, row);
                    break;
                }
            }
        }
        for (ReconciliationRow remote : remoteRows) {
            if (remote.getMatch() != null) {
                continue;
            }
            for (ReconciliationRow row : localRows) {
                if (row.getMatch() == null && sameName(remote, row)) {
                    link(remote, row);
                    break;
                }
            }
        }
        return new CategoryRows(sorted(remoteRows), sorted(localRows));
    }

    /**
     * Remote PC requires local {@code character}; remote NPC requires {@code npc} or {@code monster};
     * an untyped local actor accepts either.
     */
    static boolean typeAllows(String remoteType, String localType) {
        String local = normalize(localType);
        if (UNTYPED.contains(local)) {
            return true;
        }
        if (RemoteEntity.PC.equals(remoteType)) {
            return local.equals("character");
        }
        if (RemoteEntity.NPC.equals(remoteType)) {
            return NPC_TYPES.contains(local);
        }
        return true;
    }

    private static List<ReconciliationRow> remoteRows(List<RemoteEntity> entities, boolean characters) {
        List<ReconciliationRow> rows = new ArrayList<>(entities.size());
        for (RemoteEntity entity : entities) {
            rows.add(new ReconciliationRow(entity.id(), entity.name(),
                    characters ? entity.characterType() : entity.type(), entity.image()));
        }
        return rows;
    }

    private static List<ReconciliationRow> relabel(List<ReconciliationRow> rows, List<ReconciliationCandidate> classified) {
        Map<String, String> typeById = new HashMap<>();
        classified.forEach(c -> typeById.put(c.id(), c.type()));
        List<ReconciliationRow> out = new ArrayList<>(rows.size());
        for (ReconciliationRow row : rows) {
            ReconciliationRow copy = new ReconciliationRow(row.getId(), row.getName(),
                    typeById.getOrDefault(row.getId(), row.getType()), row.getImage());
            copy.setMatch(row.getMatch());
            copy.setSelected(row.isSelected());
            out.add(copy);
        }
        return out;
    }

    private static boolean sameName(ReconciliationRow a, ReconciliationRow b) {
        String left = normalize(a.getName());
        return !left.isEmpty() && left.equals(normalize(b.getName()));
    }

    private static void link(ReconciliationRow remote, ReconciliationRow local) {
        remote.setMatch(local.getId());
        local.setMatch(remote.getId());
    }

    private static List<ReconciliationRow> sorted(List<ReconciliationRow> rows) {
        List<ReconciliationRow> copy = new ArrayList<>(rows);
        copy.sort(BY_NAME);
        return copy;
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}

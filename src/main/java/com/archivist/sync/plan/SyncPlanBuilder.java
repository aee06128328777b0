package com.archivist.sync.plan;

import com.archivist.sync.reconcile.Category;
import com.archivist.sync.reconcile.ReconciliationResult;
import com.archivist.sync.reconcile.ReconciliationRow;
import com.archivist.sync.reconcile.Side;
import com.archivist.sync.remote.RemoteEntity;
import com.archivist.sync.remote.RemoteSession;
import com.archivist.sync.remote.RemoteSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a confirmed reconciliation into a {@link SyncPlan}.
 *
 * <ul>
 *   <li>selected remote row with a match: link job</li>
 *   <li>selected remote row without a match: import candidate, created locally when opted in,
 *       otherwise imported as a reference sheet</li>
 *   <li>selected local row without a match: export job</li>
 *   <li>factions and dated sessions: imported in full, regardless of selection</li>
 * </ul>
 */
public class SyncPlanBuilder {
    private static final Logger log = LoggerFactory.getLogger(SyncPlanBuilder.class);

    private static final List<Category> MATCHED_CATEGORIES =
            List.of(Category.CHARACTERS, Category.ITEMS, Category.LOCATIONS);

    /**
     * Uses the factions and sessions of the snapshot the reconciliation was computed from.
     */
    public SyncPlan build(ReconciliationResult reconciliation, CreateLocalChoices choices) {
        RemoteSnapshot remote = reconciliation.getRemote();
        return build(reconciliation, choices, remote.factions(), remote.sessions());
    }

    public SyncPlan build(ReconciliationResult reconciliation, CreateLocalChoices choices,
                          List<RemoteEntity> remoteFactions, List<RemoteSession> remoteSessions) {
        RemoteSnapshot source = reconciliation.getRemote();
        List<SyncJob> createLocal = new ArrayList<>();
        List<SyncJob> imports = new ArrayList<>();
        List<SyncJob> exports = new ArrayList<>();
        List<SyncJob> links = new ArrayList<>();
        Map<Category, List<RemoteEntity>> candidates = new EnumMap<>(Category.class);

        for (Category category : MATCHED_CATEGORIES) {
            List<RemoteEntity> categoryCandidates = new ArrayList<>();
            for (ReconciliationRow row : reconciliation.rows(category, Side.REMOTE)) {
                if (!row.isSelected()) {
                    continue;
                }
                SyncJobKind kind = SyncJobKind.of(category, row.getType());
                if (row.isMatched()) {
                    links.add(SyncJob.link(kind, row.getName(), row.getMatch(), row.getId()));
                    continue;
                }
                source.find(category.getRemoteKind(), row.getId()).ifPresent(categoryCandidates::add);
                if (choices.contains(category, row.getId())) {
                    createLocal.add(SyncJob.createLocal(kind, row.getName(), row.getId()));
                } else {
                    imports.add(SyncJob.importRemote(kind, row.getName(), row.getId()));
                }
            }
            candidates.put(category, categoryCandidates);

            for (ReconciliationRow row : reconciliation.rows(category, Side.LOCAL)) {
                if (row.isSelected() && !row.isMatched()) {
                    exports.add(SyncJob.export(exportKind(category, row.getType()), row.getName(), row.getId()));
                }
            }
        }

        for (RemoteEntity faction : remoteFactions) {
            imports.add(SyncJob.importRemote(SyncJobKind.FACTION, faction.name(), faction.id()));
        }
        candidates.put(Category.FACTIONS, List.copyOf(remoteFactions));

        List<SyncJob> recaps = remoteSessions.stream()
                .filter(RemoteSession::isDated)
                .sorted(RECAP_ORDER)
                .map(s -> SyncJob.recap(s.title(), s.id()))
                .toList();

        SyncPlan plan = new SyncPlan(source, createLocal, imports, recaps, exports, links, candidates);
        log.info("sync.plan.built id={} campaign={} createLocal={} imports={} recaps={} exports={} links={}",
                plan.getId(), plan.getCampaignId(), createLocal.size(), imports.size(), recaps.size(),
                exports.size(), links.size());
        return plan;
    }

    /**
     * Oldest first by parsed instant; unparseable dates go last, ties fall back to the raw date then the id.
     */
    static final Comparator<RemoteSession> RECAP_ORDER = Comparator
            .comparing((RemoteSession s) -> s.sessionInstant().orElse(null),
                    Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparing(RemoteSession::sessionDate)
            .thenComparing(RemoteSession::id);

    /**
     * Local characters export as PC only when typed {@code character}.
     */
    static SyncJobKind exportKind(Category category, String localType) {
        if (category == Category.CHARACTERS) {
            return "character".equalsIgnoreCase(localType) ? SyncJobKind.PC : SyncJobKind.NPC;
        }
        return SyncJobKind.of(category, localType);
    }
}

package com.archivist.sync.refresh;

import com.archivist.sync.core.model.MetadataValidationException;
import com.archivist.sync.core.model.OutboundBuckets;
import com.archivist.sync.core.model.RecordMetadata;
import com.archivist.sync.core.model.RelationshipBucket;
import com.archivist.sync.core.model.SheetType;
import com.archivist.sync.link.LinkGraphIndexer;
import com.archivist.sync.logging.LogContext;
import com.archivist.sync.plan.SheetWriter;
import com.archivist.sync.remote.RemoteCampaignService;
import com.archivist.sync.remote.RemoteEntity;
import com.archivist.sync.remote.RemoteEntityKind;
import com.archivist.sync.remote.RemoteLink;
import com.archivist.sync.remote.RemoteSession;
import com.archivist.sync.remote.RemoteServiceException;
import com.archivist.sync.remote.RemoteSnapshot;
import com.archivist.sync.store.LocalRecord;
import com.archivist.sync.store.LocalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One-shot alignment of the engine-owned sheets with the remote campaign.
 *
 * <p>Creates missing sheets for every remote character, item, location and faction and
 * renames sheets whose remote name changed; sheet bodies are never overwritten. Recaps are
 * upserted per session. Location parents and relationship refs are taken from the remote
 * side. Links whose endpoints have no sheet are skipped.</p>
 */
public class RemoteRefreshService {
    private static final Logger log = LoggerFactory.getLogger(RemoteRefreshService.class);

    private final LocalStore store;
    private final RemoteCampaignService remote;
    private final SheetWriter sheets;
    private final LinkGraphIndexer indexer;

    public RemoteRefreshService(LocalStore store, RemoteCampaignService remote, LinkGraphIndexer indexer) {
        this.store = store;
        this.remote = remote;
        this.sheets = new SheetWriter(store);
        this.indexer = indexer;
    }

    /**
     * @throws RemoteServiceException if the remote campaign cannot be read
     */
    public RefreshResult runFull(String campaignId) {
        Objects.requireNonNull(campaignId, "campaignId");
        try (LogContext ctx = LogContext.forReconcile(campaignId)) {
            RemoteSnapshot snapshot = RemoteSnapshot.load(remote, campaignId);
            int created = 0;
            int updated = 0;
            Map<String, String> sheetIdByRemoteId = new HashMap<>();
            for (RemoteEntityKind kind : RemoteEntityKind.values()) {
                for (RemoteEntity entity : snapshot.entities(kind)) {
                    SheetWriter.SheetWrite write = sheets.ensureSheet(kind, entity, campaignId);
                    sheetIdByRemoteId.putIfAbsent(entity.id(), write.sheetId());
                    if (write.change() == SheetWriter.Change.CREATED) {
                        created++;
                    } else if (write.change() == SheetWriter.Change.UPDATED) {
                        updated++;
                    }
                }
            }

            int recapsCreated = 0;
            int recapsUpdated = 0;
            for (RemoteSession session : snapshot.sessions()) {
                SheetWriter.SheetWrite write = sheets.upsertRecap(session, campaignId);
                if (write.change() == SheetWriter.Change.CREATED) {
                    recapsCreated++;
                } else if (write.change() == SheetWriter.Change.UPDATED) {
                    recapsUpdated++;
                }
            }

            int parents = reconcileParents(snapshot, sheetIdByRemoteId);

            int applied = 0;
            int skipped = 0;
            for (RemoteLink link : snapshot.links()) {
                if (applyLink(link, sheetIdByRemoteId)) {
                    applied++;
                } else {
                    skipped++;
                }
            }

            indexer.rebuild();
            RefreshResult result = new RefreshResult(created, updated, recapsCreated, recapsUpdated,
                    parents, applied, skipped);
            log.info("refresh.done sheetsCreated={} sheetsUpdated={} recapsCreated={} recapsUpdated={} "
                            + "parentsUpdated={} linksApplied={} linksSkipped={}",
                    created, updated, recapsCreated, recapsUpdated, parents, applied, skipped);
            return result;
        }
    }

    private int reconcileParents(RemoteSnapshot snapshot, Map<String, String> sheetIdByRemoteId) {
        int changed = 0;
        for (RemoteEntity location : snapshot.locations()) {
            Optional<LocalRecord> sheet = sheets.findSheet(location.id(), EnumSet.of(SheetType.LOCATION));
            if (sheet.isEmpty()) {
                continue;
            }
            String current = sheet.get().getMetadata().getParentLocationId().orElse(null);
            if (Objects.equals(current, location.parentId())) {
                continue;
            }
            try {
                store.setParentLocation(sheet.get().getId(), location.parentId());
                changed++;
            } catch (MetadataValidationException e) {
                log.warn("refresh.parent.rejected location={} parent={} error={}",
                        location.id(), location.parentId(), e.getMessage());
            }
        }
        return changed;
    }

    /**
     * The source sheet gets a ref and an outbound edge in the target's bucket; the target
     * sheet gets a ref back in the source's bucket.
     */
    private boolean applyLink(RemoteLink link, Map<String, String> sheetIdByRemoteId) {
        String fromSheet = sheetIdByRemoteId.get(link.fromId());
        String toSheet = sheetIdByRemoteId.get(link.toId());
        if (fromSheet == null || toSheet == null) {
            log.debug("refresh.link.skipped id={} from={} to={}", link.id(), link.fromId(), link.toId());
            return false;
        }
        Optional<RelationshipBucket> bucketTo = RelationshipBucket.forEntityType(link.toType());
        Optional<RelationshipBucket> bucketFrom = RelationshipBucket.forEntityType(link.fromType());
        if (bucketTo.isPresent()) {
            RecordMetadata meta = store.find(fromSheet).orElseThrow().getMetadata();
            store.setRelationshipMetadata(fromSheet,
                    meta.getRelationshipOutbound().orElse(OutboundBuckets.empty()).with(bucketTo.get(), link.toId()),
                    meta.getRelationshipRefs().orElse(OutboundBuckets.empty()).with(bucketTo.get(), link.toId()));
        }
        if (bucketFrom.isPresent()) {
            RecordMetadata meta = store.find(toSheet).orElseThrow().getMetadata();
            store.setRelationshipMetadata(toSheet,
                    meta.getRelationshipOutbound().orElse(null),
                    meta.getRelationshipRefs().orElse(OutboundBuckets.empty()).with(bucketFrom.get(), link.fromId()));
        }
        return true;
    }
}

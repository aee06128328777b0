package com.archivist.sync.link;

import com.archivist.sync.core.model.OutboundBuckets;
import com.archivist.sync.core.model.RecordMetadata;
import com.archivist.sync.core.model.RelationshipBucket;
import com.archivist.sync.core.model.SheetType;
import com.archivist.sync.remote.RemoteCampaignService;
import com.archivist.sync.remote.RemoteEntityKind;
import com.archivist.sync.remote.RemoteLink;
import com.archivist.sync.remote.RemoteLinkPayload;
import com.archivist.sync.remote.RemoteServiceException;
import com.archivist.sync.store.LocalRecord;
import com.archivist.sync.store.LocalRecordNotFoundException;
import com.archivist.sync.store.LocalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Mutations of relationship and hierarchy metadata. Every successful mutation rebuilds
 * the link graph.
 *
 * <p>With a remote service attached, links between two records that both carry a remote id
 * are mirrored to the remote link table. The local edge is written first and stays in place
 * when the remote call fails.</p>
 */
public class LinkService {
    private static final Logger log = LoggerFactory.getLogger(LinkService.class);

    private final LocalStore store;
    private final LinkGraphIndexer indexer;
    private final RemoteCampaignService remote;
    private final String campaignId;

    public LinkService(LocalStore store, LinkGraphIndexer indexer) {
        this(store, indexer, null, null);
    }

    public LinkService(LocalStore store, LinkGraphIndexer indexer, RemoteCampaignService remote, String campaignId) {
        this.store = store;
        this.indexer = indexer;
        this.remote = remote;
        this.campaignId = campaignId;
    }

    /**
     * Records an edge from {@code fromId} to {@code toId}. The target gets a symmetric ref back
     * in the bucket of the source's kind.
     *
     * @throws LocalRecordNotFoundException if either record does not exist
     */
    public void linkDocs(String fromId, String toId, RelationshipBucket bucket) {
        LocalRecord from = require(fromId);
        LocalRecord to = require(toId);
        RelationshipBucket back = bucketFor(from);

        RecordMetadata fromMeta = from.getMetadata();
        store.setRelationshipMetadata(fromId,
                fromMeta.effectiveOutbound().with(bucket, to.getEntityId()),
                refs(fromMeta).with(bucket, to.getEntityId()));

        RecordMetadata toMeta = to.getMetadata();
        store.setRelationshipMetadata(toId,
                toMeta.getRelationshipOutbound().orElse(null),
                refs(toMeta).with(back, from.getEntityId()));

        log.debug("links.linked from={} to={} bucket={}", fromId, toId, bucket.getKey());
        indexer.rebuild();
        mirrorLink(from, to);
    }

    /**
     * Removes what {@link #linkDocs} added. Unknown edges are ignored.
     */
    public void unlinkDocs(String fromId, String toId, RelationshipBucket bucket) {
        LocalRecord from = require(fromId);
        LocalRecord to = require(toId);
        RelationshipBucket back = bucketFor(from);

        RecordMetadata fromMeta = from.getMetadata();
        store.setRelationshipMetadata(fromId,
                fromMeta.effectiveOutbound().without(bucket, to.getEntityId()),
                refs(fromMeta).without(bucket, to.getEntityId()));

        RecordMetadata toMeta = to.getMetadata();
        store.setRelationshipMetadata(toId,
                toMeta.getRelationshipOutbound().map(o -> o.without(back, from.getEntityId())).orElse(null),
                refs(toMeta).without(back, from.getEntityId()));

        log.debug("links.unlinked from={} to={} bucket={}", fromId, toId, bucket.getKey());
        indexer.rebuild();
        mirrorUnlink(from, to);
    }

    /**
     * Points a location at a new parent, or clears it when {@code parentId} is null.
     * {@code parentId} may be a local record id or an entity id; the pointer is stored as the
     * parent's entity id. With a remote service attached and a bound child, the new parent is
     * sent to the remote as well.
     *
     * @return false if the move would create a cycle; nothing is written in that case
     */
    public boolean setLocationParent(String childId, String parentId) {
        LocalRecord child = require(childId);
        String parentEntityId = parentId != null ? entityIdOf(parentId) : null;
        if (parentEntityId != null) {
            LinkGraph graph = indexer.rebuild();
            Set<String> visited = new HashSet<>();
            String cursor = parentEntityId;
            while (cursor != null && visited.add(cursor)) {
                if (cursor.equals(child.getEntityId()) || cursor.equals(childId)) {
                    log.warn("links.parent.rejected child={} parent={} reason=cycle", childId, parentId);
                    return false;
                }
                cursor = parentOf(graph, cursor).orElse(null);
            }
        }
        store.setParentLocation(childId, parentEntityId);
        indexer.rebuild();
        mirrorParent(child, parentEntityId);
        return true;
    }

    private String entityIdOf(String id) {
        return store.find(id).map(LocalRecord::getEntityId).orElse(id);
    }

    /**
     * Parent of a location known by entity id or by local record id.
     */
    private Optional<String> parentOf(LinkGraph graph, String id) {
        Optional<String> parent = graph.parentOf(id);
        if (parent.isPresent()) {
            return parent;
        }
        return store.find(id).flatMap(record -> graph.parentOf(record.getEntityId()));
    }

    private void mirrorParent(LocalRecord child, String parentEntityId) {
        Optional<String> childRemote = child.getRemoteId();
        if (remote == null || childRemote.isEmpty()) {
            return;
        }
        if (parentEntityId != null && store.find(parentEntityId).filter(p -> p.getRemoteId().isEmpty()).isPresent()) {
            log.debug("links.remote.parent.skipped child={} parent={} reason=unbound", childRemote.get(), parentEntityId);
            return;
        }
        try {
            remote.updateLocationParent(childRemote.get(), parentEntityId);
        } catch (RemoteServiceException e) {
            log.warn("links.remote.parent.failed child={} parent={} error={}", childRemote.get(), parentEntityId, e.getMessage());
        }
    }

    private void mirrorLink(LocalRecord from, LocalRecord to) {
        Optional<String> fromRemote = from.getRemoteId();
        Optional<String> toRemote = to.getRemoteId();
        if (remote == null || fromRemote.isEmpty() || toRemote.isEmpty()) {
            return;
        }
        try {
            String linkId = remote.createLink(new RemoteLinkPayload(campaignId,
                    fromRemote.get(), remoteTypeFor(from), toRemote.get(), remoteTypeFor(to)));
            log.debug("links.remote.created id={} from={} to={}", linkId, fromRemote.get(), toRemote.get());
        } catch (RemoteServiceException e) {
            log.warn("links.remote.create.failed from={} to={} error={}", fromRemote.get(), toRemote.get(), e.getMessage());
        }
    }

    private void mirrorUnlink(LocalRecord from, LocalRecord to) {
        Optional<String> fromRemote = from.getRemoteId();
        Optional<String> toRemote = to.getRemoteId();
        if (remote == null || fromRemote.isEmpty() || toRemote.isEmpty()) {
            return;
        }
        try {
            for (RemoteLink link : remote.listLinks(campaignId)) {
                if (link.id() != null && link.fromId().equals(fromRemote.get()) && link.toId().equals(toRemote.get())) {
                    remote.deleteLink(link.id());
                    log.debug("links.remote.deleted id={}", link.id());
                }
            }
        } catch (RemoteServiceException e) {
            log.warn("links.remote.delete.failed from={} to={} error={}", fromRemote.get(), toRemote.get(), e.getMessage());
        }
    }

    /**
     * Type name the remote link table uses for a record, {@code Entry} for anything that is
     * not a character, item, location or faction.
     */
    public static String remoteTypeFor(LocalRecord record) {
        return switch (bucketFor(record)) {
            case CHARACTERS -> RemoteEntityKind.CHARACTER.getTypeName();
            case ITEMS -> RemoteEntityKind.ITEM.getTypeName();
            case LOCATIONS_ASSOCIATIVE -> RemoteEntityKind.LOCATION.getTypeName();
            case FACTIONS -> RemoteEntityKind.FACTION.getTypeName();
            case ENTRIES -> "Entry";
        };
    }

    /**
     * Bucket that stores edges pointing at records like this one.
     */
    public static RelationshipBucket bucketFor(LocalRecord record) {
        return switch (record.getKind()) {
            case CHARACTER -> RelationshipBucket.CHARACTERS;
            case ITEM -> RelationshipBucket.ITEMS;
            case LOCATION -> RelationshipBucket.LOCATIONS_ASSOCIATIVE;
            case FACTION -> RelationshipBucket.FACTIONS;
            case NOTE -> RelationshipBucket.ENTRIES;
            case SHEET -> record.getMetadata().getSheetType()
                    .map(LinkService::bucketForSheet)
                    .orElse(RelationshipBucket.ENTRIES);
        };
    }

    private static RelationshipBucket bucketForSheet(SheetType type) {
        if (type.isCharacter()) {
            return RelationshipBucket.CHARACTERS;
        }
        return switch (type) {
            case ITEM -> RelationshipBucket.ITEMS;
            case LOCATION -> RelationshipBucket.LOCATIONS_ASSOCIATIVE;
            case FACTION -> RelationshipBucket.FACTIONS;
            default -> RelationshipBucket.ENTRIES;
        };
    }

    private static OutboundBuckets refs(RecordMetadata metadata) {
        return metadata.getRelationshipRefs().orElse(OutboundBuckets.empty());
    }

    private LocalRecord require(String id) {
        return store.find(id).orElseThrow(() -> new LocalRecordNotFoundException(id));
    }
}

package com.archivist.sync.link;

import com.archivist.sync.core.model.OutboundBuckets;
import com.archivist.sync.core.model.RelationshipBucket;
import com.archivist.sync.core.model.SheetType;
import com.archivist.sync.remote.RemoteLink;
import com.archivist.sync.store.LocalRecord;
import com.archivist.sync.store.LocalRecordKind;
import com.archivist.sync.store.LocalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds {@link LinkGraph} snapshots from record metadata.
 *
 * <p>The graph is replaced wholesale on every rebuild. Readers holding an older snapshot keep
 * a consistent, if stale, view.</p>
 */
public class LinkGraphIndexer {
    private static final Logger log = LoggerFactory.getLogger(LinkGraphIndexer.class);

    private final LocalStore store;
    private volatile LinkGraph current = LinkGraph.empty();

    public LinkGraphIndexer(LocalStore store) {
        this.store = store;
    }

    /**
     * The latest snapshot; empty until the first rebuild.
     */
    public LinkGraph current() {
        return current;
    }

    /**
     * Re-reads every record of the store and replaces the current graph.
     */
    public LinkGraph rebuild() {
        List<LocalRecord> records = new ArrayList<>();
        for (LocalRecordKind kind : LocalRecordKind.values()) {
            records.addAll(store.list(kind));
        }
        LinkGraph graph = build(records);
        current = graph;
        log.debug("links.rebuilt records={} entities={}", records.size(), graph.size());
        return graph;
    }

    public LinkGraph build(Collection<LocalRecord> records) {
        Map<String, OutboundBuckets> outbound = new LinkedHashMap<>();
        Map<String, String> parents = new LinkedHashMap<>();
        Map<String, List<String>> associates = new HashMap<>();
        Map<String, String> recordIds = new HashMap<>();

        for (LocalRecord record : records) {
            String entityId = record.getEntityId();
            recordIds.putIfAbsent(entityId, record.getId());
            OutboundBuckets edges = record.getMetadata().effectiveOutbound();
            outbound.merge(entityId, edges, OutboundBuckets::merge);
            record.getMetadata().getParentLocationId().ifPresent(p -> parents.putIfAbsent(entityId, p));
            if (isLocation(record)) {
                List<String> refs = edges.get(RelationshipBucket.LOCATIONS_ASSOCIATIVE);
                if (!refs.isEmpty()) {
                    associates.computeIfAbsent(entityId, k -> new ArrayList<>()).addAll(refs);
                }
            }
        }

        Map<String, List<String>> children = new LinkedHashMap<>();
        parents.forEach((child, parent) -> children.computeIfAbsent(parent, k -> new ArrayList<>()).add(child));

        Map<String, List<String>> ancestors = new HashMap<>();
        Set<String> locations = new HashSet<>(parents.keySet());
        locations.addAll(parents.values());
        for (String location : locations) {
            ancestors.put(location, ancestorChain(location, parents));
        }

        Map<String, List<String>> dedupedAssociates = new HashMap<>();
        associates.forEach((k, v) -> dedupedAssociates.put(k, List.copyOf(new LinkedHashSet<>(v))));
        Map<String, List<String>> frozenChildren = new HashMap<>();
        children.forEach((k, v) -> frozenChildren.put(k, List.copyOf(v)));

        return new LinkGraph(outbound, parents, frozenChildren, ancestors, dedupedAssociates, recordIds);
    }

    /**
     * Walks parent pointers and returns the chain root-first. Stops at the first id seen twice.
     */
    static List<String> ancestorChain(String locationId, Map<String, String> parents) {
        List<String> chain = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(locationId);
        String cursor = parents.get(locationId);
        while (cursor != null && visited.add(cursor)) {
            chain.add(cursor);
            cursor = parents.get(cursor);
        }
        Collections.reverse(chain);
        return List.copyOf(chain);
    }

    /**
     * Outbound edges as recorded by the remote link table. Links whose target type has no
     * bucket are ignored.
     */
    public static Map<String, OutboundBuckets> buildFromRemoteLinks(Collection<RemoteLink> links) {
        Map<String, Map<RelationshipBucket, List<String>>> raw = new LinkedHashMap<>();
        for (RemoteLink link : links) {
            Optional<RelationshipBucket> bucket = RelationshipBucket.forEntityType(link.toType());
            if (bucket.isEmpty()) {
                log.debug("links.remote.ignored id={} toType={}", link.id(), link.toType());
                continue;
            }
            raw.computeIfAbsent(link.fromId(), k -> new EnumMap<>(RelationshipBucket.class))
                    .computeIfAbsent(bucket.get(), k -> new ArrayList<>())
                    .add(link.toId());
        }
        Map<String, OutboundBuckets> out = new LinkedHashMap<>();
        raw.forEach((from, buckets) -> out.put(from, OutboundBuckets.of(buckets)));
        return out;
    }

    static boolean isLocation(LocalRecord record) {
        return record.getKind() == LocalRecordKind.LOCATION
                || record.getMetadata().getSheetType().filter(t -> t == SheetType.LOCATION).isPresent();
    }
}

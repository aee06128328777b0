package com.archivist.sync.link;

import com.archivist.sync.core.model.OutboundBuckets;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of the relationship graph, keyed by entity id.
 *
 * <p>Derived from record metadata; never written back. A snapshot may be stale as soon as
 * the store changes, callers needing fresh data ask the indexer to rebuild.</p>
 */
public final class LinkGraph {

    private static final LinkGraph EMPTY = new LinkGraph(Map.of(), Map.of(), Map.of(), Map.of(), Map.of(), Map.of());

    private final Map<String, OutboundBuckets> outboundByFromId;
    private final Map<String, String> parentByLocationId;
    private final Map<String, List<String>> childrenByLocationId;
    private final Map<String, List<String>> ancestorsByLocationId;
    private final Map<String, List<String>> associatesByLocationId;
    private final Map<String, String> recordIdByEntityId;

    LinkGraph(Map<String, OutboundBuckets> outboundByFromId,
              Map<String, String> parentByLocationId,
              Map<String, List<String>> childrenByLocationId,
              Map<String, List<String>> ancestorsByLocationId,
              Map<String, List<String>> associatesByLocationId,
              Map<String, String> recordIdByEntityId) {
        this.outboundByFromId = Map.copyOf(outboundByFromId);
        this.parentByLocationId = Map.copyOf(parentByLocationId);
        this.childrenByLocationId = Map.copyOf(childrenByLocationId);
        this.ancestorsByLocationId = Map.copyOf(ancestorsByLocationId);
        this.associatesByLocationId = Map.copyOf(associatesByLocationId);
        this.recordIdByEntityId = Map.copyOf(recordIdByEntityId);
    }

    public static LinkGraph empty() {
        return EMPTY;
    }

    public OutboundBuckets outbound(String entityId) {
        return outboundByFromId.getOrDefault(entityId, OutboundBuckets.empty());
    }

    public Map<String, OutboundBuckets> outboundByFromId() {
        return outboundByFromId;
    }

    public Optional<String> parentOf(String locationId) {
        return Optional.ofNullable(parentByLocationId.get(locationId));
    }

    public List<String> children(String locationId) {
        return childrenByLocationId.getOrDefault(locationId, List.of());
    }

    /**
     * Ancestors ordered from the root down to the direct parent.
     */
    public List<String> ancestors(String locationId) {
        return ancestorsByLocationId.getOrDefault(locationId, List.of());
    }

    public List<String> associates(String locationId) {
        return associatesByLocationId.getOrDefault(locationId, List.of());
    }

    public Optional<String> recordId(String entityId) {
        return Optional.ofNullable(recordIdByEntityId.get(entityId));
    }

    public int size() {
        return outboundByFromId.size();
    }
}

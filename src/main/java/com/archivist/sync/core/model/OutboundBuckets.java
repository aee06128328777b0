package com.archivist.sync.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable set of entity ids grouped by {@link RelationshipBucket}.
 * Ids inside a bucket are unique and keep insertion order.
 */
public final class OutboundBuckets {

    private static final OutboundBuckets EMPTY = new OutboundBuckets(new EnumMap<>(RelationshipBucket.class));

    private final Map<RelationshipBucket, List<String>> buckets;

    private OutboundBuckets(Map<RelationshipBucket, List<String>> buckets) {
        EnumMap<RelationshipBucket, List<String>> copy = new EnumMap<>(RelationshipBucket.class);
        for (RelationshipBucket bucket : RelationshipBucket.values()) {
            List<String> ids = buckets.get(bucket);
            copy.put(bucket, ids != null ? List.copyOf(ids) : List.of());
        }
        this.buckets = copy;
    }

    public static OutboundBuckets empty() {
        return EMPTY;
    }

    public static OutboundBuckets of(Map<RelationshipBucket, ? extends Collection<String>> source) {
        EnumMap<RelationshipBucket, List<String>> map = new EnumMap<>(RelationshipBucket.class);
        source.forEach((bucket, ids) -> map.put(bucket, dedupe(ids)));
        return new OutboundBuckets(map);
    }

    public List<String> get(RelationshipBucket bucket) {
        return buckets.get(bucket);
    }

    public boolean contains(RelationshipBucket bucket, String id) {
        return buckets.get(bucket).contains(id);
    }

    public boolean isEmpty() {
        return buckets.values().stream().allMatch(List::isEmpty);
    }

    /**
     * Returns a copy with {@code id} appended to {@code bucket}; unchanged if already present.
     */
    public OutboundBuckets with(RelationshipBucket bucket, String id) {
        Objects.requireNonNull(id, "id is required");
        if (contains(bucket, id)) {
            return this;
        }
        EnumMap<RelationshipBucket, List<String>> map = new EnumMap<>(buckets);
        List<String> ids = new ArrayList<>(map.get(bucket));
        ids.add(id);
        map.put(bucket, ids);
        return new OutboundBuckets(map);
    }

    public OutboundBuckets without(RelationshipBucket bucket, String id) {
        if (!contains(bucket, id)) {
            return this;
        }
        EnumMap<RelationshipBucket, List<String>> map = new EnumMap<>(buckets);
        List<String> ids = new ArrayList<>(map.get(bucket));
        ids.remove(id);
        map.put(bucket, ids);
        return new OutboundBuckets(map);
    }

    /**
     * Union of both bucket sets, this side's ids first.
     */
    public OutboundBuckets merge(OutboundBuckets other) {
        EnumMap<RelationshipBucket, List<String>> map = new EnumMap<>(RelationshipBucket.class);
        for (RelationshipBucket bucket : RelationshipBucket.values()) {
            List<String> ids = new ArrayList<>(get(bucket));
            ids.addAll(other.get(bucket));
            map.put(bucket, dedupe(ids));
        }
        return new OutboundBuckets(map);
    }

    public Map<RelationshipBucket, List<String>> asMap() {
        return Map.copyOf(buckets);
    }

    private static List<String> dedupe(Collection<String> ids) {
        if (ids == null) {
            return List.of();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String id : ids) {
            if (id != null && !id.isBlank()) {
                unique.add(id);
            }
        }
        return new ArrayList<>(unique);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OutboundBuckets that = (OutboundBuckets) o;
        return buckets.equals(that.buckets);
    }

    @Override
    public int hashCode() {
        return buckets.hashCode();
    }

    @Override
    public String toString() {
        return "OutboundBuckets" + buckets;
    }
}

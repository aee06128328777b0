package com.archivist.sync.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OutboundBucketsTest {

    @Test
    @DisplayName("Should drop duplicates and blank ids")
    void testDedupe() {
        OutboundBuckets buckets = OutboundBuckets.of(Map.of(
                RelationshipBucket.CHARACTERS, Arrays.asList("a", "b", "a", " ", null)));

        assertEquals(List.of("a", "b"), buckets.get(RelationshipBucket.CHARACTERS));
        assertEquals(List.of(), buckets.get(RelationshipBucket.ITEMS));
    }

    @Test
    @DisplayName("with should be idempotent")
    void testWithIdempotent() {
        OutboundBuckets once = OutboundBuckets.empty().with(RelationshipBucket.ITEMS, "i-1");
        OutboundBuckets twice = once.with(RelationshipBucket.ITEMS, "i-1");

        assertSame(once, twice);
        assertEquals(List.of("i-1"), twice.get(RelationshipBucket.ITEMS));
    }

    @Test
    @DisplayName("without should remove only the given id")
    void testWithout() {
        OutboundBuckets buckets = OutboundBuckets.empty()
                .with(RelationshipBucket.FACTIONS, "f-1")
                .with(RelationshipBucket.FACTIONS, "f-2")
                .without(RelationshipBucket.FACTIONS, "f-1");

        assertEquals(List.of("f-2"), buckets.get(RelationshipBucket.FACTIONS));
        assertSame(buckets, buckets.without(RelationshipBucket.ITEMS, "missing"));
    }

    @Test
    @DisplayName("merge should union both sides, this side first")
    void testMerge() {
        OutboundBuckets left = OutboundBuckets.empty()
                .with(RelationshipBucket.CHARACTERS, "a")
                .with(RelationshipBucket.CHARACTERS, "b");
        OutboundBuckets right = OutboundBuckets.empty()
                .with(RelationshipBucket.CHARACTERS, "b")
                .with(RelationshipBucket.CHARACTERS, "c")
                .with(RelationshipBucket.ENTRIES, "e");

        OutboundBuckets merged = left.merge(right);

        assertEquals(List.of("a", "b", "c"), merged.get(RelationshipBucket.CHARACTERS));
        assertEquals(List.of("e"), merged.get(RelationshipBucket.ENTRIES));
        assertFalse(merged.isEmpty());
        assertTrue(OutboundBuckets.empty().isEmpty());
    }

    @Test
    @DisplayName("Should map remote endpoint types to buckets")
    void testForEntityType() {
        assertEquals(RelationshipBucket.CHARACTERS, RelationshipBucket.forEntityType("Character").orElseThrow());
        assertEquals(RelationshipBucket.LOCATIONS_ASSOCIATIVE, RelationshipBucket.forEntityType("location").orElseThrow());
        assertEquals(RelationshipBucket.ENTRIES, RelationshipBucket.forEntityType("JournalEntry").orElseThrow());
        assertTrue(RelationshipBucket.forEntityType("Session").isEmpty());
        assertTrue(RelationshipBucket.forEntityType(null).isEmpty());
    }
}

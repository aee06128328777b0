package com.archivist.sync.link;

import com.archivist.sync.core.model.OutboundBuckets;
import com.archivist.sync.core.model.RecordMetadata;
import com.archivist.sync.core.model.RelationshipBucket;
import com.archivist.sync.core.model.SheetType;
import com.archivist.sync.remote.FakeRemoteCampaignService;
import com.archivist.sync.remote.RemoteEntity;
import com.archivist.sync.remote.RemoteEntityKind;
import com.archivist.sync.remote.RemoteLink;
import com.archivist.sync.store.InMemoryLocalStore;
import com.archivist.sync.store.LocalRecord;
import com.archivist.sync.store.LocalRecordKind;
import com.archivist.sync.store.LocalRecordNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LinkServiceTest {

    private InMemoryLocalStore store;
    private LinkGraphIndexer indexer;
    private LinkService links;

    @BeforeEach
    void setUp() {
        store = new InMemoryLocalStore();
        indexer = new LinkGraphIndexer(store);
        links = new LinkService(store, indexer);
    }

    private static LocalRecord record(String id, LocalRecordKind kind, String remoteId, String parentId) {
        return LocalRecord.builder()
                .id(id)
                .kind(kind)
                .name(id)
                .metadata(RecordMetadata.builder().remoteId(remoteId).parentLocationId(parentId).build())
                .build();
    }

    @Nested
    @DisplayName("Relationships")
    class RelationshipTests {

        @BeforeEach
        void setUpRecords() {
            store.put(record("actor-1", LocalRecordKind.CHARACTER, null, null));
            store.put(record("item-1", LocalRecordKind.ITEM, "r-i", null));
        }

        @Test
        @DisplayName("linkDocs should write the edge and the back reference")
        void testLink() {
            links.linkDocs("actor-1", "item-1", RelationshipBucket.ITEMS);

            RecordMetadata from = store.find("actor-1").orElseThrow().getMetadata();
            RecordMetadata to = store.find("item-1").orElseThrow().getMetadata();
            assertEquals(List.of("r-i"), from.getRelationshipOutbound().orElseThrow().get(RelationshipBucket.ITEMS));
            assertEquals(List.of("r-i"), from.getRelationshipRefs().orElseThrow().get(RelationshipBucket.ITEMS));
            assertEquals(List.of("actor-1"), to.getRelationshipRefs().orElseThrow().get(RelationshipBucket.CHARACTERS));
            assertTrue(to.getRelationshipOutbound().isEmpty());

            LinkGraph graph = indexer.current();
            assertEquals(List.of("r-i"), graph.outbound("actor-1").get(RelationshipBucket.ITEMS));
            assertEquals(List.of("actor-1"), graph.outbound("r-i").get(RelationshipBucket.CHARACTERS));
        }

        @Test
        @DisplayName("Linking twice should not duplicate edges")
        void testLinkIdempotent() {
            links.linkDocs("actor-1", "item-1", RelationshipBucket.ITEMS);
            links.linkDocs("actor-1", "item-1", RelationshipBucket.ITEMS);

            assertEquals(List.of("r-i"), indexer.current().outbound("actor-1").get(RelationshipBucket.ITEMS));
        }

        @Test
        @DisplayName("unlinkDocs should remove the edge and the back reference")
        void testUnlink() {
            links.linkDocs("actor-1", "item-1", RelationshipBucket.ITEMS);
            links.unlinkDocs("actor-1", "item-1", RelationshipBucket.ITEMS);

            assertTrue(indexer.current().outbound("actor-1").isEmpty());
            assertTrue(indexer.current().outbound("r-i").isEmpty());
            for (String id : List.of("actor-1", "item-1")) {
                RecordMetadata metadata = store.find(id).orElseThrow().getMetadata();
                assertTrue(metadata.getRelationshipOutbound().map(OutboundBuckets::isEmpty).orElse(true), id);
                assertTrue(metadata.getRelationshipRefs().map(OutboundBuckets::isEmpty).orElse(true), id);
            }
        }

        @Test
        @DisplayName("Unknown records should be rejected")
        void testUnknownRecord() {
            assertThrows(LocalRecordNotFoundException.class,
                    () -> links.linkDocs("actor-1", "missing", RelationshipBucket.ITEMS));
        }
    }

    @Nested
    @DisplayName("Location hierarchy")
    class HierarchyTests {

        @BeforeEach
        void setUpLocations() {
            store.put(record("scene-1", LocalRecordKind.LOCATION, "r-world", null));
            store.put(record("scene-2", LocalRecordKind.LOCATION, "r-city", "r-world"));
            store.put(record("scene-3", LocalRecordKind.LOCATION, "r-tavern", "r-city"));
        }

        @Test
        @DisplayName("Should move a location under a new parent")
        void testMove() {
            assertTrue(links.setLocationParent("scene-3", "r-world"));

            assertEquals("r-world", indexer.current().parentOf("r-tavern").orElseThrow());
            assertEquals(List.of("r-world"), indexer.current().ancestors("r-tavern"));
        }

        @Test
        @DisplayName("Should refuse a move that creates a cycle")
        void testCycle() {
            assertFalse(links.setLocationParent("scene-1", "r-tavern"));

            assertTrue(store.find("scene-1").orElseThrow().getMetadata().getParentLocationId().isEmpty());
        }

        @Test
        @DisplayName("Should refuse a location as its own parent")
        void testSelfParent() {
            assertFalse(links.setLocationParent("scene-2", "r-city"));
            assertFalse(links.setLocationParent("scene-2", "scene-2"));
        }

        @Test
        @DisplayName("Local ids of bound locations should not bypass the cycle check")
        void testCycleThroughLocalIds() {
            store.put(record("scene-a", LocalRecordKind.LOCATION, "r-a", null));
            store.put(record("scene-b", LocalRecordKind.LOCATION, "r-b", null));

            assertTrue(links.setLocationParent("scene-b", "scene-a"));
            assertFalse(links.setLocationParent("scene-a", "scene-b"));

            assertEquals("r-a", store.find("scene-b").orElseThrow().getMetadata().getParentLocationId().orElseThrow());
            assertTrue(store.find("scene-a").orElseThrow().getMetadata().getParentLocationId().isEmpty());
            assertEquals(List.of("r-a"), indexer.current().ancestors("r-b"));
        }

        @Test
        @DisplayName("Parent pointers stored as local ids should still be followed")
        void testLegacyLocalPointer() {
            store.put(record("scene-a", LocalRecordKind.LOCATION, "r-a", null));
            store.put(record("scene-b", LocalRecordKind.LOCATION, "r-b", "scene-a"));

            assertFalse(links.setLocationParent("scene-a", "r-b"));
        }

        @Test
        @DisplayName("A null parent should clear the hierarchy link")
        void testClear() {
            assertTrue(links.setLocationParent("scene-2", null));

            assertTrue(indexer.current().parentOf("r-city").isEmpty());
            assertEquals(List.of("r-city"), indexer.current().ancestors("r-tavern"));
        }
    }

    @Nested
    @DisplayName("Remote mirror")
    class RemoteMirrorTests {

        private FakeRemoteCampaignService remote;
        private LinkService mirrored;

        @BeforeEach
        void setUpRemote() {
            remote = new FakeRemoteCampaignService();
            mirrored = new LinkService(store, indexer, remote, "c-1");
            store.put(record("actor-1", LocalRecordKind.CHARACTER, "r-1", null));
            store.put(record("item-1", LocalRecordKind.ITEM, "r-i", null));
            store.put(record("journal-1", LocalRecordKind.NOTE, null, null));
        }

        @Test
        @DisplayName("Linking two bound records should create a remote link")
        void testLinkMirrored() {
            mirrored.linkDocs("actor-1", "item-1", RelationshipBucket.ITEMS);

            assertEquals(1, remote.links().size());
            RemoteLink link = remote.links().values().iterator().next();
            assertEquals("r-1", link.fromId());
            assertEquals("Character", link.fromType());
            assertEquals("r-i", link.toId());
            assertEquals("Item", link.toType());
        }

        @Test
        @DisplayName("Unbound records should only be linked locally")
        void testUnboundNotMirrored() {
            mirrored.linkDocs("actor-1", "journal-1", RelationshipBucket.ENTRIES);

            assertTrue(remote.links().isEmpty());
            assertEquals(List.of("journal-1"),
                    store.find("actor-1").orElseThrow().getMetadata().getRelationshipRefs().orElseThrow()
                            .get(RelationshipBucket.ENTRIES));
        }

        @Test
        @DisplayName("Unlinking should delete the matching remote links only")
        void testUnlinkMirrored() {
            remote.addLink(new RemoteLink("k-other", "r-1", "Character", "r-x", "Item"));
            mirrored.linkDocs("actor-1", "item-1", RelationshipBucket.ITEMS);

            mirrored.unlinkDocs("actor-1", "item-1", RelationshipBucket.ITEMS);

            assertEquals(1, remote.links().size());
            assertTrue(remote.links().containsKey("k-other"));
        }

        @Test
        @DisplayName("Re-parenting a bound location should send the new parent")
        void testParentMirrored() {
            remote.add(RemoteEntityKind.LOCATION, RemoteEntity.named("r-cellar", "Cellar"));
            store.put(record("scene-1", LocalRecordKind.LOCATION, "r-harbor", null));
            store.put(record("scene-2", LocalRecordKind.LOCATION, "r-cellar", null));

            assertTrue(mirrored.setLocationParent("scene-2", "scene-1"));
            assertEquals("r-harbor", remote.get(RemoteEntityKind.LOCATION, "r-cellar").parentId());

            assertTrue(mirrored.setLocationParent("scene-2", null));
            assertNull(remote.get(RemoteEntityKind.LOCATION, "r-cellar").parentId());
            assertEquals(List.of("r-cellar", "r-cellar"), remote.updatedIds());
        }

        @Test
        @DisplayName("An unbound parent should stay local")
        void testUnboundParentNotMirrored() {
            remote.add(RemoteEntityKind.LOCATION, RemoteEntity.named("r-cellar", "Cellar"));
            store.put(record("scene-1", LocalRecordKind.LOCATION, null, null));
            store.put(record("scene-2", LocalRecordKind.LOCATION, "r-cellar", null));

            assertTrue(mirrored.setLocationParent("scene-2", "scene-1"));

            assertTrue(remote.updatedIds().isEmpty());
            assertEquals("scene-1", store.find("scene-2").orElseThrow().getMetadata().getParentLocationId().orElseThrow());
        }

        @Test
        @DisplayName("A failed parent update should keep the local parent")
        void testParentFailureKeepsLocalEdit() {
            store.put(record("scene-1", LocalRecordKind.LOCATION, "r-harbor", null));
            store.put(record("scene-2", LocalRecordKind.LOCATION, "r-cellar", null));
            remote.failWrites(RemoteEntityKind.LOCATION);

            assertTrue(mirrored.setLocationParent("scene-2", "scene-1"));

            assertEquals("r-harbor", indexer.current().parentOf("r-cellar").orElseThrow());
        }

        @Test
        @DisplayName("A remote failure should keep the local unlink")
        void testRemoteFailureKeepsLocalEdit() {
            mirrored.linkDocs("actor-1", "item-1", RelationshipBucket.ITEMS);
            remote.failListing();

            assertDoesNotThrow(() -> mirrored.unlinkDocs("actor-1", "item-1", RelationshipBucket.ITEMS));

            assertTrue(indexer.current().outbound("r-1").get(RelationshipBucket.ITEMS).isEmpty());
            assertEquals(1, remote.links().size());
        }
    }

    @Test
    @DisplayName("Remote type names should follow the link bucket")
    void testRemoteTypeFor() {
        assertEquals("Location", LinkService.remoteTypeFor(record("scene-9", LocalRecordKind.LOCATION, null, null)));
        assertEquals("Entry", LinkService.remoteTypeFor(record("journal-9", LocalRecordKind.NOTE, null, null)));
    }

    @Test
    @DisplayName("bucketFor should follow the record kind and sheet type")
    void testBucketFor() {
        LocalRecord npcSheet = LocalRecord.builder().id("sheet-1").kind(LocalRecordKind.SHEET).name("Mira")
                .metadata(RecordMetadata.builder().sheetType(SheetType.NPC).build()).build();
        LocalRecord recap = LocalRecord.builder().id("sheet-2").kind(LocalRecordKind.SHEET).name("Recap")
                .metadata(RecordMetadata.builder().sheetType(SheetType.RECAP).build()).build();

        assertEquals(RelationshipBucket.CHARACTERS, LinkService.bucketFor(npcSheet));
        assertEquals(RelationshipBucket.ENTRIES, LinkService.bucketFor(recap));
        assertEquals(RelationshipBucket.LOCATIONS_ASSOCIATIVE,
                LinkService.bucketFor(record("scene-9", LocalRecordKind.LOCATION, null, null)));
    }
}

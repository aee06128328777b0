package com.archivist.sync.store;

import com.archivist.sync.core.model.MetadataValidationException;
import com.archivist.sync.core.model.OutboundBuckets;
import com.archivist.sync.core.model.RecordMetadata;
import com.archivist.sync.core.model.RelationshipBucket;
import com.archivist.sync.core.model.SheetType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryLocalStoreTest {

    private InMemoryLocalStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryLocalStore();
    }

    @Test
    @DisplayName("Should create records with kind-prefixed ids")
    void testCreate() {
        String actorId = store.createCharacter(new NewRecord("Mira", "npc", "", null, "", null));
        String sheetId = store.createSheet(NewRecord.named("Recap",
                RecordMetadata.builder().sheetType(SheetType.RECAP).build()));

        assertTrue(actorId.startsWith("actor-"));
        assertTrue(sheetId.startsWith("sheet-"));
        assertEquals("npc", store.find(actorId).orElseThrow().getType());
        assertEquals(1, store.listCharacters().size());
        assertEquals(1, store.listSheets().size());
        assertEquals(2, store.size());
    }

    @Test
    @DisplayName("Should bind a cross reference and find by remote id")
    void testCrossReference() {
        String id = store.createItem(NewRecord.named("Sword", null));
        store.setCrossReference(id, "r-9", "c-1");

        LocalRecord record = store.findByRemoteId(LocalRecordKind.ITEM, "r-9").orElseThrow();
        assertEquals(id, record.getId());
        assertEquals("r-9", record.getEntityId());
        assertTrue(record.getMetadata().isBoundTo("c-1"));
        assertTrue(store.findByRemoteId(LocalRecordKind.ITEM, null).isEmpty());
    }

    @Test
    @DisplayName("Should keep other metadata when writing relationships")
    void testRelationshipMetadata() {
        String id = store.createCharacter(NewRecord.named("Mira",
                RecordMetadata.builder().fingerprint("f-1").build()));
        OutboundBuckets outbound = OutboundBuckets.empty().with(RelationshipBucket.ITEMS, "i-1");

        store.setRelationshipMetadata(id, outbound, OutboundBuckets.empty());

        RecordMetadata metadata = store.find(id).orElseThrow().getMetadata();
        assertEquals("f-1", metadata.getFingerprint().orElseThrow());
        assertEquals(List.of("i-1"), metadata.effectiveOutbound().get(RelationshipBucket.ITEMS));
    }

    @Test
    @DisplayName("Should refuse a location that is its own parent")
    void testSelfParent() {
        String id = store.createLocation(NewRecord.named("Keep", null));

        assertThrows(MetadataValidationException.class, () -> store.setParentLocation(id, id));
        assertTrue(store.find(id).orElseThrow().getMetadata().getParentLocationId().isEmpty());
    }

    @Test
    @DisplayName("Writes to an unknown id should throw")
    void testUnknownId() {
        LocalRecordNotFoundException e = assertThrows(LocalRecordNotFoundException.class,
                () -> store.rename("missing", "x"));
        assertEquals("missing", e.getRecordId());
    }

    @Test
    @DisplayName("Should delete sheets only")
    void testDeleteSheet() {
        String actorId = store.createCharacter(NewRecord.named("Mira", null));
        String sheetId = store.createSheet(NewRecord.named("Sheet", null));

        assertFalse(store.deleteSheet(actorId));
        assertTrue(store.deleteSheet(sheetId));
        assertFalse(store.deleteSheet(sheetId));
        assertEquals(1, store.size());
    }
}

package com.archivist.sync.reset;

import com.archivist.sync.core.model.RecordMetadata;
import com.archivist.sync.link.LinkGraphIndexer;
import com.archivist.sync.plan.SheetWriter;
import com.archivist.sync.remote.RemoteEntity;
import com.archivist.sync.remote.RemoteEntityKind;
import com.archivist.sync.store.InMemoryLocalStore;
import com.archivist.sync.store.LocalRecord;
import com.archivist.sync.store.LocalRecordKind;
import com.archivist.sync.store.NewRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SyncResetServiceTest {

    private InMemoryLocalStore store;
    private LinkGraphIndexer indexer;
    private SyncResetService reset;

    private String bound;
    private String plain;
    private String sheet;

    @BeforeEach
    void setUp() {
        store = new InMemoryLocalStore();
        indexer = new LinkGraphIndexer(store);
        reset = new SyncResetService(store, indexer);

        bound = store.createCharacter(new NewRecord("Mira", "npc", "", null, "Smuggler",
                RecordMetadata.builder().remoteId("r-1").remoteCampaignId("c-1").fingerprint("abc").build()));
        plain = store.createCharacter(new NewRecord("Tess", "character", "", null, "", null));
        sheet = new SheetWriter(store).ensureSheet(RemoteEntityKind.FACTION, RemoteEntity.named("f-1", "Guild"), "c-1")
                .sheetId();
        store.put(LocalRecord.builder()
                .id("sheet-host")
                .kind(LocalRecordKind.SHEET)
                .name("Handwritten notes")
                .build());
        indexer.rebuild();
    }

    @Test
    @DisplayName("Metadata-only reset should clear core records and keep sheets")
    void testMetadataOnly() {
        ResetResult result = reset.reset(ResetMode.METADATA_ONLY);

        assertEquals(1, result.recordsCleared());
        assertEquals(0, result.sheetsRemoved());
        LocalRecord mira = store.find(bound).orElseThrow();
        assertTrue(mira.getMetadata().isEmpty());
        assertEquals("Smuggler", mira.getDescription());
        assertTrue(store.find(plain).isPresent());
        assertTrue(store.find(sheet).isPresent());
        assertTrue(indexer.current().recordId("r-1").isEmpty());
    }

    @Test
    @DisplayName("Removing sheets should only delete engine-owned sheets")
    void testRemoveSheets() {
        ResetResult result = reset.reset(ResetMode.REMOVE_SHEETS);

        assertEquals(1, result.recordsCleared());
        assertEquals(1, result.sheetsRemoved());
        assertTrue(store.find(sheet).isEmpty());
        assertTrue(store.find("sheet-host").isPresent());
        assertEquals(2, store.listCharacters().size());
    }

    @Test
    @DisplayName("A second reset should change nothing")
    void testIdempotent() {
        reset.reset(ResetMode.REMOVE_SHEETS);

        ResetResult second = reset.reset(ResetMode.REMOVE_SHEETS);

        assertTrue(second.isNoOp());
    }
}

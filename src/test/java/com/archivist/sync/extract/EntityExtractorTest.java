package com.archivist.sync.extract;

import com.archivist.sync.core.model.EntityKind;
import com.archivist.sync.core.model.EntityLink;
import com.archivist.sync.core.model.GenericEntity;
import com.archivist.sync.store.InMemoryLocalStore;
import com.archivist.sync.store.LocalRecord;
import com.archivist.sync.store.LocalRecordKind;
import com.archivist.sync.store.TextPage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EntityExtractorTest {

    private InMemoryLocalStore store;
    private EntityExtractor extractor;

    @BeforeEach
    void setUp() {
        store = new InMemoryLocalStore();
        extractor = new EntityExtractor();
    }

    @Test
    @DisplayName("Should project a character with links, tags and flattened stats")
    void testCharacter() {
        store.put(LocalRecord.builder()
                .id("actor-1")
                .kind(LocalRecordKind.CHARACTER)
                .name("Mira")
                .type("npc")
                .folderName("NPCs")
                .image("mira.png")
                .attribute("biography", Map.of("value", "<p>A <strong>spy</strong> @UUID[Actor.x]{Ally} #rogue</p>"))
                .attribute("hp", Map.of("value", 12))
                .attribute("alignment", "neutral")
                .build());

        GenericEntity entity = extractor.extract(store).get(0);

        assertEquals(EntityKind.CHARACTER, entity.getKind());
        assertEquals("npc", entity.getSubtype());
        assertEquals("actor-1", entity.getSourceId());
        assertEquals("A spy Ally #rogue", entity.getBody());
        assertEquals(List.of(new EntityLink(EntityLink.UUID_TYPE, "Actor.x")), entity.getLinks());
        assertTrue(entity.getTags().contains("npcs"));
        assertTrue(entity.getTags().contains("rogue"));
        assertEquals(12L, entity.getStats().get("hp"));
        assertEquals("neutral", entity.getStats().get("alignment"));
        assertEquals(List.of("mira.png"), entity.getImages());
        assertEquals("npc", entity.getMetadata().get("type"));
    }

    @Test
    @DisplayName("Should join journal pages and collect journal links")
    void testJournal() {
        store.put(LocalRecord.builder()
                .id("journal-1")
                .kind(LocalRecordKind.NOTE)
                .name("Rumours")
                .page(TextPage.text("<p>First @JournalEntry[Harbor]</p>"))
                .page(new TextPage("Map", "", "map.png"))
                .page(TextPage.text("<p>Second</p>"))
                .build());

        GenericEntity entity = extractor.extract(store).get(0);

        assertEquals(EntityKind.JOURNAL, entity.getKind());
        assertEquals("First Second", entity.getBody());
        assertEquals(List.of(new EntityLink(EntityLink.JOURNAL_TYPE, "Harbor")), entity.getLinks());
        assertEquals(List.of("map.png"), entity.getImages());
        assertEquals(3, entity.getMetadata().get("pages"));
    }

    @Test
    @DisplayName("Should use pin notes and background for locations")
    void testLocation() {
        store.put(LocalRecord.builder()
                .id("scene-1")
                .kind(LocalRecordKind.LOCATION)
                .name("Harbor")
                .attribute("notes", List.of(Map.of("text", "Dock"), Map.of("text", "Tavern")))
                .attribute("background", "harbor.webp")
                .build());

        GenericEntity entity = extractor.extract(store).get(0);

        assertEquals(EntityKind.LOCATION, entity.getKind());
        assertEquals("scene", entity.getSubtype());
        assertEquals("Dock Tavern", entity.getBody());
        assertEquals(List.of("harbor.webp"), entity.getImages());
    }

    @Test
    @DisplayName("Should honour the sample limit")
    void testSampleLimit() {
        for (int i = 0; i < 5; i++) {
            store.put(LocalRecord.builder().id("item-" + i).kind(LocalRecordKind.ITEM).name("Item " + i).build());
        }

        assertEquals(5, extractor.extract(store).size());
        assertEquals(2, extractor.extract(store, 2).size());
    }

    @Test
    @DisplayName("Sheets should not be extracted")
    void testSheetsIgnored() {
        store.put(LocalRecord.builder().id("sheet-1").kind(LocalRecordKind.SHEET).name("Recap").build());

        assertTrue(extractor.extract(store).isEmpty());
    }
}

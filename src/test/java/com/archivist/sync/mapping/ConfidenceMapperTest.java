package com.archivist.sync.mapping;

import com.archivist.sync.core.model.EntityKind;
import com.archivist.sync.core.model.GenericEntity;
import com.archivist.sync.core.model.MappingProposal;
import com.archivist.sync.core.model.TargetType;
import com.archivist.sync.metrics.SyncMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;

class ConfidenceMapperTest {

    private final ConfidenceMapper mapper = new ConfidenceMapper();

    private static GenericEntity.Builder character(String name, String type) {
        return GenericEntity.builder()
                .kind(EntityKind.CHARACTER)
                .subtype(type)
                .name(name)
                .sourceId("actor-" + name)
                .body(name + " is here.")
                .metadata("type", type);
    }

    @Nested
    @DisplayName("Generic preset")
    class GenericPresetTests {

        @Test
        @DisplayName("Player character should map to Character with the PC label")
        void testPlayerCharacter() {
            GenericEntity entity = character("Aria", "character")
                    .image("https://cdn.example.com/aria.png")
                    .tag("pcs")
                    .build();

            MappingProposal proposal = mapper.map(entity);

            assertEquals(TargetType.CHARACTER, proposal.targetType());
            assertEquals("actor-pc", proposal.ruleName());
            assertTrue(proposal.hasLabel("pc"));
            assertEquals(1.0, proposal.score(), 1e-9);
            assertEquals("Aria", proposal.payload().get("title"));
            assertEquals("Aria is here.", proposal.payload().get("description"));
            assertEquals("https://cdn.example.com/aria.png", proposal.payload().get("portraitUrl"));
        }

        @Test
        @DisplayName("NPC should score lower and drop a relative image path")
        void testNpc() {
            GenericEntity entity = character("Mira", "npc").image("tokens/mira.png").build();

            MappingProposal proposal = mapper.map(entity);

            assertEquals("actor-npc", proposal.ruleName());
            assertTrue(proposal.hasLabel("NPC"));
            assertEquals(0.92, proposal.score(), 1e-9);
            assertFalse(proposal.payload().containsKey("portraitUrl"));
        }

        @Test
        @DisplayName("Journal in a factions folder should map to Faction")
        void testFaction() {
            GenericEntity entity = GenericEntity.builder()
                    .kind(EntityKind.JOURNAL)
                    .subtype("journal")
                    .name("Order of the Rose")
                    .sourceId("journal-1")
                    .folderName("Factions")
                    .tag("factions")
                    .build();

            MappingProposal proposal = mapper.map(entity);

            assertEquals(TargetType.FACTION, proposal.targetType());
            assertEquals(1.0, proposal.score(), 1e-9);
        }

        @Test
        @DisplayName("Unclassified journal should fall back to a Note")
        void testFallback() {
            GenericEntity entity = GenericEntity.builder()
                    .kind(EntityKind.JOURNAL)
                    .name("Shopping list")
                    .sourceId("journal-2")
                    .body("bread")
                    .build();

            MappingProposal proposal = mapper.map(entity);

            assertEquals(TargetType.NOTE, proposal.targetType());
            assertEquals("fallback-note", proposal.ruleName());
            assertEquals(0.30, proposal.score(), 1e-9);
            assertEquals("bread", proposal.payload().get("content"));
        }
    }

    @Test
    @DisplayName("Preset without rules should yield an unmatched Note")
    void testEmptyPreset() {
        GenericEntity entity = character("Mira", "npc").build();

        MappingProposal proposal = mapper.map(entity, new MappingPreset("bare", 1, List.of()));

        assertEquals(TargetType.NOTE, proposal.targetType());
        assertNull(proposal.ruleName());
        assertEquals(ConfidenceMapper.UNMATCHED_SCORE, proposal.score(), 1e-9);
        assertEquals("Mira", proposal.payload().get("title"));
    }

    @Test
    @DisplayName("Equal scores should keep the earlier rule")
    void testTieKeepsEarlierRule() {
        MappingPreset preset = new MappingPreset("tie", 1, List.of(
                MappingRule.builder().name("first").mapTo(TargetType.ITEM).build(),
                MappingRule.builder().name("second").mapTo(TargetType.NOTE).build()));
        GenericEntity entity = GenericEntity.builder().kind(EntityKind.ITEM).name("Rope").sourceId("item-1").build();

        assertEquals("first", mapper.map(entity, preset).ruleName());
    }

    @Test
    @DisplayName("isExternalUrl should accept only absolute http(s) URLs")
    void testIsExternalUrl() {
        assertTrue(ConfidenceMapper.isExternalUrl("https://example.com/a.png"));
        assertTrue(ConfidenceMapper.isExternalUrl("HTTP://example.com/a.png"));
        assertFalse(ConfidenceMapper.isExternalUrl("icons/a.png"));
        assertFalse(ConfidenceMapper.isExternalUrl("data:image/png;base64,xx"));
        assertFalse(ConfidenceMapper.isExternalUrl("not a url"));
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("Metrics")
    class MetricsTests {

        @Mock
        private SyncMetrics metrics;

        @Test
        @DisplayName("Should record the score of every proposal")
        void testRecordsScore() {
            ConfidenceMapper withMetrics = new ConfidenceMapper(new MappingPresets(), "generic", metrics);

            MappingProposal proposal = withMetrics.map(character("Mira", "npc").build());

            verify(metrics).recordMappingScore(proposal.score());
        }
    }
}

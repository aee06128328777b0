package com.archivist.sync.mapping;

import com.archivist.sync.core.model.EntityKind;
import com.archivist.sync.core.model.GenericEntity;
import com.archivist.sync.core.model.MappingProposal;
import com.archivist.sync.core.model.TargetType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MappingPresetsTest {

    private MappingPresets presets;

    @BeforeEach
    void setUp() {
        presets = new MappingPresets();
    }

    private static InputStream json(String json) {
        return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Unknown or blank system should resolve to the generic preset")
    void testFallbackToGeneric() {
        assertSame(MappingPresets.generic(), presets.forSystem("pf2e"));
        assertSame(MappingPresets.generic(), presets.forSystem(null));
        assertSame(MappingPresets.generic(), presets.forSystem(" "));
    }

    @Test
    @DisplayName("Should load a preset extending the generic rules")
    void testLoadJson() throws Exception {
        MappingPreset preset;
        try (InputStream in = getClass().getResourceAsStream("/presets/dnd5e.json")) {
            preset = presets.loadJson(in);
        }

        assertEquals("dnd5e", preset.id());
        List<String> names = preset.rules().stream().map(MappingRule::getName).toList();
        assertEquals(List.of("actor-pc", "actor-npc", "journal-faction", "scene-location", "item",
                "fallback-note", "journal-lore"), names);

        presets.register("DnD5e", preset);
        assertSame(preset, presets.forSystem(" dnd5e "));

        GenericEntity lore = GenericEntity.builder()
                .kind(EntityKind.JOURNAL)
                .name("The Fall of Thay")
                .sourceId("journal-1")
                .folderName("History")
                .build();
        MappingProposal proposal = new ConfidenceMapper(presets, "dnd5e", null).map(lore);
        assertEquals("journal-lore", proposal.ruleName());
        assertEquals(0.85, proposal.score(), 1e-9);
    }

    @Test
    @DisplayName("Overridden NPC rule should no longer accept monsters")
    void testOverrideReplacesRule() throws Exception {
        MappingPreset preset;
        try (InputStream in = getClass().getResourceAsStream("/presets/dnd5e.json")) {
            preset = presets.loadJson(in);
        }
        GenericEntity monster = GenericEntity.builder()
                .kind(EntityKind.CHARACTER)
                .subtype("monster")
                .name("Owlbear")
                .sourceId("actor-9")
                .metadata("type", "monster")
                .build();

        assertEquals("fallback-note", new ConfidenceMapper().map(monster, preset).ruleName());
        assertEquals("actor-npc", new ConfidenceMapper().map(monster).ruleName());
    }

    @Test
    @DisplayName("registerOverrides should append new rules to the generic preset")
    void testRegisterOverrides() {
        MappingRule rule = MappingRule.builder()
                .name("vehicle")
                .when(MappingCondition.kind(EntityKind.ITEM).and(MappingCondition.eq("subtype", "vehicle")))
                .mapTo(TargetType.LOCATION)
                .build();

        MappingPreset preset = presets.registerOverrides("starfinder", List.of(rule));

        assertEquals(MappingPresets.generic().rules().size() + 1, preset.rules().size());
        assertSame(preset, presets.forSystem("starfinder"));
    }

    @Test
    @DisplayName("extendsGeneric false should keep only the declared rules")
    void testStandalonePreset() {
        MappingPreset preset = presets.loadJson(json(
                "{\"id\":\"tiny\",\"extendsGeneric\":false,\"rules\":[{\"mapTo\":\"Item\"}]}"));

        assertEquals(1, preset.rules().size());
        assertEquals("tiny-rule-0", preset.rules().get(0).getName());
    }

    @Test
    @DisplayName("Malformed presets should be rejected")
    void testMalformed() {
        assertThrows(IllegalArgumentException.class, () -> presets.loadJson(json("{\"id\":\"x\"}")));
        assertThrows(IllegalArgumentException.class,
                () -> presets.loadJson(json("{\"rules\":[{\"name\":\"no-target\"}]}")));
        assertThrows(IllegalArgumentException.class,
                () -> presets.loadJson(json("{\"rules\":[{\"if\":{\"kind\":\"Spaceship\"},\"mapTo\":\"Item\"}]}")));
        assertThrows(IllegalArgumentException.class,
                () -> presets.loadJson(json("{\"rules\":[{\"mapTo\":\"Vehicle\"}]}")));
    }
}

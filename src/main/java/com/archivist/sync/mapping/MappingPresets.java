package com.archivist.sync.mapping;

import com.archivist.sync.core.model.EntityKind;
import com.archivist.sync.core.model.TargetType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of mapping presets by system id, with the built-in generic preset as default.
 *
 * <p>Presets can also be read from JSON in this shape:</p>
 * <pre>
 * {
 *   "id": "dnd5e", "version": 1,
 *   "rules": [
 *     { "name": "actor-pc",
 *       "if": { "kind": "Character", "anyOf": [ { "path": "metadata.type", "eq": "character" } ] },
 *       "mapTo": "Character",
 *       "fields": { "title": "$.name", "description": ["$.body"] },
 *       "labels": ["PC"], "confidenceBoost": 0.2 },
 *     { "name": "fallback-note", "fallback": true, "mapTo": "Note", "fields": { "title": "$.name" } }
 *   ]
 * }
 * </pre>
 */
public class MappingPresets {
    private static final Logger log = LoggerFactory.getLogger(MappingPresets.class);

    public static final String GENERIC_ID = "generic";

    private static final MappingPreset GENERIC = new MappingPreset(GENERIC_ID, 1, List.of(
            MappingRule.builder()
                    .name("actor-pc")
                    .when(MappingCondition.kind(EntityKind.CHARACTER).and(MappingCondition.anyOf(
                            MappingCondition.eq("metadata.type", "character"),
                            MappingCondition.eq("metadata.type", "pc"))))
                    .mapTo(TargetType.CHARACTER)
                    .field("title", "$.name")
                    .field("description", "$.metadata.system.biography.value", "$.body")
                    .field("portraitUrl", "$.images[0]")
                    .labels("PC")
                    .confidenceBoost(0.2)
                    .build(),
            MappingRule.builder()
                    .name("actor-npc")
                    .when(MappingCondition.kind(EntityKind.CHARACTER)
                            .and(MappingCondition.in("metadata.type", List.of("npc", "monster"))))
                    .mapTo(TargetType.CHARACTER)
                    .field("title", "$.name")
                    .field("description", "$.metadata.system.biography.value", "$.body")
                    .field("portraitUrl", "$.images[0]")
                    .labels("NPC")
                    .build(),
            MappingRule.builder()
                    .name("journal-faction")
                    .when(MappingCondition.anyOf(
                                    MappingCondition.kind(EntityKind.JOURNAL),
                                    MappingCondition.kind(EntityKind.FACTION))
                            .and(MappingCondition.anyOf(
                                    MappingCondition.kind(EntityKind.FACTION),
                                    MappingCondition.matches("folderName", "factions|organizations|guilds"),
                                    MappingCondition.hasAny("tags", List.of("faction", "organization", "guild")))))
                    .mapTo(TargetType.FACTION)
                    .field("title", "$.name")
                    .field("description", "$.body")
                    .field("imageUrl", "$.images[0]")
                    .build(),
            MappingRule.builder()
                    .name("scene-location")
                    .when(MappingCondition.kind(EntityKind.LOCATION))
                    .mapTo(TargetType.LOCATION)
                    .field("title", "$.name")
                    .field("description", "$.body")
                    .field("imageUrl", "$.images[0]")
                    .build(),
            MappingRule.builder()
                    .name("item")
                    .when(MappingCondition.kind(EntityKind.ITEM))
                    .mapTo(TargetType.ITEM)
                    .field("title", "$.name")
                    .field("description", "$.body")
                    .field("imageUrl", "$.images[0]")
                    .build(),
            MappingRule.builder()
                    .name("fallback-note")
                    .fallback(true)
                    .mapTo(TargetType.NOTE)
                    .field("title", "$.name")
                    .field("content", "$.body")
                    .build()
    ));

    private final Map<String, MappingPreset> presets = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public MappingPresets() {
        this(new ObjectMapper());
    }

    public MappingPresets(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static MappingPreset generic() {
        return GENERIC;
    }

    /**
     * Registers a preset for a system id, replacing any earlier registration.
     */
    public void register(String systemId, MappingPreset preset) {
        presets.put(normalize(systemId), preset);
        log.debug("mapping.preset.registered system={} rules={}", systemId, preset.rules().size());
    }

    /**
     * Registers the generic preset with the given rules overriding or extending it by rule name.
     */
    public MappingPreset registerOverrides(String systemId, List<MappingRule> overrides) {
        MappingPreset preset = GENERIC.withOverrides(normalize(systemId), overrides);
        register(systemId, preset);
        return preset;
    }

    /**
     * The preset registered for a system id, or the generic preset.
     */
    public MappingPreset forSystem(String systemId) {
        if (systemId == null || systemId.isBlank()) {
            return GENERIC;
        }
        return presets.getOrDefault(normalize(systemId), GENERIC);
    }

    /**
     * Reads a preset from JSON. Unless {@code "extendsGeneric": false} is set, the rules
     * override generic rules of the same name and the remaining generic rules are kept.
     *
     * @throws IllegalArgumentException if the document is malformed
     */
    public MappingPreset loadJson(InputStream in) {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read mapping preset", e);
        }
        if (root == null || !root.path("rules").isArray()) {
            throw new IllegalArgumentException("Mapping preset must contain a 'rules' array");
        }
        String id = root.path("id").asText(GENERIC_ID);
        List<MappingRule> rules = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root.path("rules")) {
            rules.add(parseRule(node, id + "-rule-" + index++));
        }
        MappingPreset preset = root.path("extendsGeneric").asBoolean(true)
                ? GENERIC.withOverrides(id, rules)
                : new MappingPreset(id, root.path("version").asInt(1), rules);
        log.info("mapping.preset.loaded id={} rules={}", id, preset.rules().size());
        return preset;
    }

    private MappingRule parseRule(JsonNode node, String defaultName) {
        String mapTo = node.path("mapTo").asText(null);
        if (mapTo == null) {
            throw new IllegalArgumentException("Rule '" + defaultName + "' has no mapTo");
        }
        MappingRule.Builder builder = MappingRule.builder()
                .name(node.path("name").asText(defaultName))
                .mapTo(TargetType.fromLabel(mapTo))
                .fallback(node.path("fallback").asBoolean(false))
                .confidenceBoost(node.path("confidenceBoost").asDouble(0.0));
        if (node.has("if")) {
            builder.when(parseCondition(node.get("if")));
        }
        node.path("fields").fields().forEachRemaining(entry -> {
            JsonNode value = entry.getValue();
            List<String> sources = new ArrayList<>();
            if (value.isArray()) {
                value.forEach(v -> sources.add(v.asText()));
            } else {
                sources.add(value.asText());
            }
            builder.field(entry.getKey(), sources);
        });
        List<String> labels = new ArrayList<>();
        node.path("labels").forEach(l -> labels.add(l.asText()));
        builder.labels(labels);
        return builder.build();
    }

    /**
     * Each key of a condition object adds a clause; all clauses must hold.
     */
    MappingCondition parseCondition(JsonNode node) {
        List<MappingCondition> clauses = new ArrayList<>();
        if (node.has("kind")) {
            clauses.add(MappingCondition.kind(parseKind(node.get("kind").asText())));
        }
        String path = node.path("path").asText(null);
        if (path != null) {
            if (node.has("eq")) {
                clauses.add(MappingCondition.eq(stripRoot(path), node.get("eq").asText()));
            }
            if (node.path("in").isArray()) {
                List<String> values = new ArrayList<>();
                node.get("in").forEach(v -> values.add(v.asText()));
                clauses.add(MappingCondition.in(stripRoot(path), values));
            }
            if (node.has("matches")) {
                clauses.add(MappingCondition.matches(stripRoot(path), node.get("matches").asText()));
            }
            if (node.path("hasAny").isArray()) {
                List<String> values = new ArrayList<>();
                node.get("hasAny").forEach(v -> values.add(v.asText()));
                clauses.add(MappingCondition.hasAny(stripRoot(path), values));
            }
        }
        if (node.path("anyOf").isArray()) {
            List<MappingCondition> any = new ArrayList<>();
            node.get("anyOf").forEach(c -> any.add(parseCondition(c)));
            clauses.add(MappingCondition.anyOf(any.toArray(MappingCondition[]::new)));
        }
        if (node.path("allOf").isArray()) {
            List<MappingCondition> all = new ArrayList<>();
            node.get("allOf").forEach(c -> all.add(parseCondition(c)));
            clauses.add(MappingCondition.allOf(all.toArray(MappingCondition[]::new)));
        }
        if (clauses.isEmpty()) {
            return MappingCondition.ALWAYS;
        }
        return MappingCondition.allOf(clauses.toArray(MappingCondition[]::new));
    }

    /**
     * Accepts entity kind labels plus the host document names Actor, Scene and Journal.
     */
    private static EntityKind parseKind(String value) {
        String wanted = value.trim().toLowerCase(Locale.ROOT);
        switch (wanted) {
            case "actor":
                return EntityKind.CHARACTER;
            case "scene":
                return EntityKind.LOCATION;
            default:
                for (EntityKind kind : EntityKind.values()) {
                    if (kind.getLabel().equalsIgnoreCase(wanted)) {
                        return kind;
                    }
                }
                throw new IllegalArgumentException("Unknown entity kind: " + value);
        }
    }

    private static String stripRoot(String path) {
        return path.startsWith("$.") ? path.substring(2) : path;
    }

    private static String normalize(String systemId) {
        return systemId.trim().toLowerCase(Locale.ROOT);
    }
}

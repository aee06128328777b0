package com.archivist.sync.mapping;

import com.archivist.sync.core.model.GenericEntity;
import com.archivist.sync.core.model.MappingProposal;
import com.archivist.sync.core.model.TargetType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * User corrections applied on top of mapping proposals.
 *
 * <p>Corrections are keyed either by entity shape ({@code kind|subtype|folder}) or by
 * source record id; a per-record correction wins over a per-shape one. A correction can
 * change the target type, re-point payload fields to other entity paths, or exclude the
 * record from import altogether.</p>
 */
public class MappingCorrections {

    /**
     * @param targetType replacement target type, or null to keep the proposed one
     * @param fieldPaths payload field to entity path overrides
     * @param include    false to exclude the record, null when unspecified
     */
    public record Correction(TargetType targetType, Map<String, String> fieldPaths, Boolean include) {
        public Correction {
            fieldPaths = fieldPaths != null ? Map.copyOf(fieldPaths) : Map.of();
        }

        public static Correction retarget(TargetType targetType) {
            return new Correction(targetType, null, null);
        }

        public static Correction exclude() {
            return new Correction(null, null, Boolean.FALSE);
        }
    }

    private final Map<String, Correction> byKey = new ConcurrentHashMap<>();
    private final Map<String, Correction> bySource = new ConcurrentHashMap<>();

    public static String keyOf(GenericEntity entity) {
        return entity.getKind().getLabel() + "|" + entity.getSubtype() + "|"
                + entity.getFolderName().toLowerCase(Locale.ROOT);
    }

    public MappingCorrections putForKey(String key, Correction correction) {
        byKey.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(correction, "correction"));
        return this;
    }

    public MappingCorrections putForSource(String sourceId, Correction correction) {
        bySource.put(Objects.requireNonNull(sourceId, "sourceId"), Objects.requireNonNull(correction, "correction"));
        return this;
    }

    public boolean isEmpty() {
        return byKey.isEmpty() && bySource.isEmpty();
    }

    /**
     * Records are included unless a per-record correction says otherwise.
     */
    public boolean isIncluded(GenericEntity entity) {
        Correction correction = bySource.get(entity.getSourceId());
        return correction == null || !Boolean.FALSE.equals(correction.include());
    }

    public MappingProposal apply(GenericEntity entity, MappingProposal proposal) {
        Correction keyFix = byKey.get(keyOf(entity));
        Correction sourceFix = bySource.get(entity.getSourceId());
        if (keyFix == null && sourceFix == null) {
            return proposal;
        }
        MappingProposal out = proposal;
        if (keyFix != null && keyFix.targetType() != null) {
            out = out.withTargetType(keyFix.targetType());
        }
        if (sourceFix != null && sourceFix.targetType() != null) {
            out = out.withTargetType(sourceFix.targetType());
        }

        Map<String, String> paths = new LinkedHashMap<>();
        if (keyFix != null) {
            paths.putAll(keyFix.fieldPaths());
        }
        if (sourceFix != null) {
            paths.putAll(sourceFix.fieldPaths());
        }
        if (!paths.isEmpty()) {
            Map<String, Object> view = EntityPaths.view(entity);
            Map<String, String> payload = new LinkedHashMap<>(out.payload());
            paths.forEach((field, path) -> {
                String expression = path.startsWith("$.") ? path : "$." + path;
                Optional<String> value = EntityPaths.evaluate(view, expression);
                value.ifPresent(v -> payload.put(field, v));
            });
            out = out.withPayload(payload);
        }
        return out;
    }

    /**
     * Reads corrections from {@code {"byKey": {...}, "bySource": {...}}}.
     * Each correction is {@code {"targetType": "Faction", "fieldPaths": {...}, "include": false}}.
     */
    public static MappingCorrections fromJson(ObjectMapper mapper, String json) {
        MappingCorrections corrections = new MappingCorrections();
        if (json == null || json.isBlank()) {
            return corrections;
        }
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed mapping corrections: " + e.getOriginalMessage(), e);
        }
        root.path("byKey").fields().forEachRemaining(e -> corrections.putForKey(e.getKey(), parse(e.getValue())));
        root.path("bySource").fields().forEachRemaining(e -> corrections.putForSource(e.getKey(), parse(e.getValue())));
        return corrections;
    }

    public String toJson(ObjectMapper mapper) {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode keys = root.putObject("byKey");
        byKey.forEach((k, c) -> keys.set(k, write(mapper, c)));
        ObjectNode sources = root.putObject("bySource");
        bySource.forEach((k, c) -> sources.set(k, write(mapper, c)));
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize mapping corrections", e);
        }
    }

    private static Correction parse(JsonNode node) {
        TargetType target = node.hasNonNull("targetType") ? TargetType.fromLabel(node.get("targetType").asText()) : null;
        Map<String, String> paths = new LinkedHashMap<>();
        node.path("fieldPaths").fields().forEachRemaining(e -> paths.put(e.getKey(), e.getValue().asText()));
        Boolean include = node.has("include") ? node.get("include").asBoolean() : null;
        return new Correction(target, paths, include);
    }

    private static ObjectNode write(ObjectMapper mapper, Correction correction) {
        ObjectNode node = mapper.createObjectNode();
        if (correction.targetType() != null) {
            node.put("targetType", correction.targetType().getLabel());
        }
        if (!correction.fieldPaths().isEmpty()) {
            ObjectNode paths = node.putObject("fieldPaths");
            correction.fieldPaths().forEach(paths::put);
        }
        if (correction.include() != null) {
            node.put("include", correction.include());
        }
        return node;
    }
}

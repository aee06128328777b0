package com.archivist.sync.mapping;

import com.archivist.sync.core.model.EntityKind;
import com.archivist.sync.core.model.GenericEntity;
import com.archivist.sync.core.model.TargetType;
import com.archivist.sync.extract.ValuePaths;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Heuristic confidence of a rule's classification of an entity.
 *
 * <p>An explicit rule match starts at {@value #MATCH_BASELINE}, a fallback at
 * {@value #FALLBACK_BASELINE}. Corroborating signals add bounded increments; the rule's
 * boost is added last and the total is clamped to [0, 1].</p>
 */
public class ConfidenceScorer {

    static final double MATCH_BASELINE = 0.55;
    static final double FALLBACK_BASELINE = 0.30;

    private static final Pattern FACTION_NAME = Pattern.compile("order|guild|house|clan|legion|company|collective");
    private static final Pattern FACTION_FOLDER = Pattern.compile("faction|organization|organisations|guild|order|house|clan");
    private static final Pattern FACTION_TAG = Pattern.compile("faction|organization|guild|order|house|clan");

    public double score(GenericEntity entity, MappingRule rule) {
        double s = rule.isFallback() ? FALLBACK_BASELINE : MATCH_BASELINE;
        if (entity.hasImages()) {
            s += 0.05;
        }
        if (entity.hasTags()) {
            s += 0.05;
        }
        if (!rule.isFallback()) {
            s += kindAgreement(entity, rule.getTargetType());
        }
        return clamp(s + rule.getConfidenceBoost());
    }

    private double kindAgreement(GenericEntity entity, TargetType target) {
        EntityKind kind = entity.getKind();
        String subtype = entity.getSubtype().toLowerCase(Locale.ROOT);
        double s = 0.0;
        if (kind == EntityKind.CHARACTER && target == TargetType.CHARACTER) {
            s += 0.25;
            if (subtype.equals("character")) {
                s += 0.10;
            }
            if (subtype.equals("npc")) {
                s += 0.07;
            }
            if (hasBiography(entity.getMetadata())) {
                s += 0.03;
            }
        } else if (kind == EntityKind.LOCATION && target == TargetType.LOCATION) {
            s += 0.25;
            if (entity.getMetadata().containsKey("background") || entity.hasImages()) {
                s += 0.05;
            }
            if (!entity.getLinks().isEmpty()) {
                s += 0.05;
            }
        } else if ((kind == EntityKind.JOURNAL || kind == EntityKind.FACTION) && target == TargetType.FACTION) {
            s += 0.20;
            if (FACTION_NAME.matcher(entity.getName().toLowerCase(Locale.ROOT)).find()) {
                s += 0.15;
            }
            if (FACTION_FOLDER.matcher(entity.getFolderName().toLowerCase(Locale.ROOT)).find()) {
                s += 0.15;
            }
            if (entity.getTags().stream().anyMatch(t -> FACTION_TAG.matcher(t.toLowerCase(Locale.ROOT)).find())) {
                s += 0.10;
            }
        }
        return s;
    }

    private static boolean hasBiography(Map<String, Object> metadata) {
        return ValuePaths.resolveText(metadata, "system.biography.value").isPresent()
                || ValuePaths.resolveText(metadata, "system.biography.public").isPresent();
    }

    static double clamp(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }
}

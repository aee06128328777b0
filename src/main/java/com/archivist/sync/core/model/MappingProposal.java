package com.archivist.sync.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Proposed remote shape for a local entity, with the confidence of the classification.
 *
 * @param targetType the remote shape
 * @param payload    target-shape fields, already materialized from the entity
 * @param labels     classification labels such as PC or NPC
 * @param score      confidence in [0, 1]
 * @param ruleName   name of the mapping rule that produced the proposal
 */
public record MappingProposal(
        TargetType targetType,
        Map<String, String> payload,
        List<String> labels,
        double score,
        String ruleName
) {
    public MappingProposal {
        Objects.requireNonNull(targetType, "targetType is required");
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0");
        }
        payload = payload != null ? Map.copyOf(payload) : Map.of();
        labels = labels != null ? List.copyOf(labels) : List.of();
    }

    public boolean hasLabel(String label) {
        return labels.stream().anyMatch(l -> l.equalsIgnoreCase(label));
    }

    public MappingProposal withTargetType(TargetType newTargetType) {
        return new MappingProposal(newTargetType, payload, labels, score, ruleName);
    }

    public MappingProposal withPayload(Map<String, String> newPayload) {
        return new MappingProposal(targetType, newPayload, labels, score, ruleName);
    }
}

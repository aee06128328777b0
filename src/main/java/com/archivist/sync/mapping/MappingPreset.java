package com.archivist.sync.mapping;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An ordered rule set. Rule order decides ties between equally scored rules.
 */
public record MappingPreset(String id, int version, List<MappingRule> rules) {

    public MappingPreset {
        Objects.requireNonNull(id, "id is required");
        rules = rules != null ? List.copyOf(rules) : List.of();
    }

    /**
     * Returns a preset where each override replaces the rule of the same name in place,
     * and overrides with a new name are appended.
     */
    public MappingPreset withOverrides(String newId, List<MappingRule> overrides) {
        List<MappingRule> merged = new ArrayList<>(rules);
        for (MappingRule override : overrides) {
            int index = indexOf(merged, override.getName());
            if (index >= 0) {
                merged.set(index, override);
            } else {
                merged.add(override);
            }
        }
        return new MappingPreset(newId, version, merged);
    }

    private static int indexOf(List<MappingRule> rules, String name) {
        for (int i = 0; i < rules.size(); i++) {
            if (rules.get(i).getName().equals(name)) {
                return i;
            }
        }
        return -1;
    }
}

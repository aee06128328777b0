package com.archivist.sync.mapping;

import com.archivist.sync.core.model.TargetType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A rule classifying entities into a {@link TargetType}.
 *
 * <p>{@code fields} maps each output field to an ordered list of source expressions;
 * the first expression that yields non-blank text wins. A fallback rule ignores its
 * condition and is used only when no other rule of the preset matched.</p>
 */
public class MappingRule {
    private final String name;
    private final MappingCondition condition;
    private final TargetType targetType;
    private final Map<String, List<String>> fields;
    private final List<String> labels;
    private final double confidenceBoost;
    private final boolean fallback;

    private MappingRule(Builder builder) {
        this.name = builder.name;
        this.condition = builder.condition != null ? builder.condition : MappingCondition.ALWAYS;
        this.targetType = builder.targetType;
        Map<String, List<String>> copy = new LinkedHashMap<>();
        builder.fields.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        this.fields = Collections.unmodifiableMap(copy);
        this.labels = List.copyOf(builder.labels);
        this.confidenceBoost = builder.confidenceBoost;
        this.fallback = builder.fallback;
    }

    public String getName() {
        return name;
    }

    public MappingCondition getCondition() {
        return condition;
    }

    public TargetType getTargetType() {
        return targetType;
    }

    public Map<String, List<String>> getFields() {
        return fields;
    }

    public List<String> getLabels() {
        return labels;
    }

    public double getConfidenceBoost() {
        return confidenceBoost;
    }

    public boolean isFallback() {
        return fallback;
    }

    public boolean matches(Map<String, Object> view) {
        return !fallback && condition.test(view);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MappingRule that = (MappingRule) o;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "MappingRule{" +
                "name='" + name + '\'' +
                ", targetType=" + targetType +
                ", labels=" + labels +
                ", fallback=" + fallback +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private MappingCondition condition;
        private TargetType targetType;
        private final Map<String, List<String>> fields = new LinkedHashMap<>();
        private final List<String> labels = new ArrayList<>();
        private double confidenceBoost;
        private boolean fallback;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder when(MappingCondition condition) {
            this.condition = condition;
            return this;
        }

        public Builder mapTo(TargetType targetType) {
            this.targetType = targetType;
            return this;
        }

        /**
         * @param sources source expressions in priority order
         */
        public Builder field(String field, String... sources) {
            this.fields.put(field, List.of(sources));
            return this;
        }

        public Builder field(String field, List<String> sources) {
            this.fields.put(field, List.copyOf(sources));
            return this;
        }

        public Builder labels(String... labels) {
            this.labels.clear();
            this.labels.addAll(List.of(labels));
            return this;
        }

        public Builder labels(List<String> labels) {
            this.labels.clear();
            this.labels.addAll(labels);
            return this;
        }

        public Builder confidenceBoost(double confidenceBoost) {
            this.confidenceBoost = confidenceBoost;
            return this;
        }

        public Builder fallback(boolean fallback) {
            this.fallback = fallback;
            return this;
        }

        public MappingRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(targetType, "targetType is required");
            return new MappingRule(this);
        }
    }
}

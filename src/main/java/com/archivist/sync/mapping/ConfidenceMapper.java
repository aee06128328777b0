package com.archivist.sync.mapping;

import com.archivist.sync.core.model.GenericEntity;
import com.archivist.sync.core.model.MappingProposal;
import com.archivist.sync.core.model.TargetType;
import com.archivist.sync.metrics.NoOpSyncMetrics;
import com.archivist.sync.metrics.SyncMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies entities into {@link MappingProposal}s using a {@link MappingPreset}.
 *
 * <p>All matching non-fallback rules are scored and the highest score wins; on a tie the
 * earlier rule is kept. The preset's fallback rule is used only when nothing matched, and a
 * preset without one yields a {@code NOTE} proposal scored {@value #UNMATCHED_SCORE}.</p>
 */
public class ConfidenceMapper {
    private static final Logger log = LoggerFactory.getLogger(ConfidenceMapper.class);

    static final double UNMATCHED_SCORE = 0.3;

    /** Output fields that must hold an absolute http(s) URL. */
    static final Set<String> IMAGE_FIELDS = Set.of("image", "imageUrl", "portraitUrl");

    private final MappingPresets presets;
    private final String systemId;
    private final ConfidenceScorer scorer;
    private final SyncMetrics metrics;

    public ConfidenceMapper() {
        this(new MappingPresets(), MappingPresets.GENERIC_ID, new NoOpSyncMetrics());
    }

    public ConfidenceMapper(MappingPresets presets, String systemId, SyncMetrics metrics) {
        this.presets = Objects.requireNonNull(presets, "presets");
        this.systemId = systemId;
        this.scorer = new ConfidenceScorer();
        this.metrics = metrics != null ? metrics : new NoOpSyncMetrics();
    }

    /**
     * Maps with the preset registered for the configured system id.
     */
    public MappingProposal map(GenericEntity entity) {
        return map(entity, presets.forSystem(systemId));
    }

    public MappingProposal map(GenericEntity entity, MappingPreset preset) {
        Map<String, Object> view = EntityPaths.view(entity);
        MappingRule best = null;
        double bestScore = -1.0;
        for (MappingRule rule : preset.rules()) {
            if (!rule.matches(view)) {
                continue;
            }
            double score = scorer.score(entity, rule);
            if (best == null || score > bestScore) {
                best = rule;
                bestScore = score;
            }
        }
        if (best == null) {
            Optional<MappingRule> fallback = preset.rules().stream().filter(MappingRule::isFallback).findFirst();
            if (fallback.isPresent()) {
                best = fallback.get();
                bestScore = scorer.score(entity, best);
            }
        }

        MappingProposal proposal;
        if (best == null) {
            Map<String, String> payload = new LinkedHashMap<>();
            payload.put("title", entity.getName());
            payload.put("content", entity.getBody());
            proposal = new MappingProposal(TargetType.NOTE, payload, List.of(), UNMATCHED_SCORE, null);
        } else {
            proposal = new MappingProposal(best.getTargetType(), materialize(best, view), best.getLabels(),
                    bestScore, best.getName());
        }
        metrics.recordMappingScore(proposal.score());
        log.debug("mapping.proposal source={} name='{}' target={} rule={} score={}",
                entity.getSourceId(), entity.getName(), proposal.targetType(), proposal.ruleName(), proposal.score());
        return proposal;
    }

    static Map<String, String> materialize(MappingRule rule, Map<String, Object> view) {
        Map<String, String> payload = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> field : rule.getFields().entrySet()) {
            boolean image = IMAGE_FIELDS.contains(field.getKey());
            for (String source : field.getValue()) {
                Optional<String> value = EntityPaths.evaluate(view, source);
                if (value.isPresent() && !value.get().isBlank() && (!image || isExternalUrl(value.get()))) {
                    payload.put(field.getKey(), value.get());
                    break;
                }
            }
        }
        return payload;
    }

    static boolean isExternalUrl(String value) {
        try {
            URI uri = URI.create(value.trim());
            String scheme = uri.getScheme();
            return uri.isAbsolute() && uri.getHost() != null && scheme != null
                    && (scheme.toLowerCase(Locale.ROOT).equals("http") || scheme.toLowerCase(Locale.ROOT).equals("https"));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}

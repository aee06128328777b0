package com.archivist.sync.fingerprint;

import com.archivist.sync.core.model.GenericEntity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Stable content hash of a {@link GenericEntity}, used to skip unchanged records.
 *
 * <p>The hash covers kind, subtype, name, body, stats, sorted tags, images in order and the
 * metadata with volatile keys removed at every level. The canonical form is JSON with map
 * entries sorted by key, hashed with SHA-256; if that digest is unavailable a 32-bit FNV-1a
 * hash is used instead.</p>
 */
public class FingerprintEngine {
    private static final Logger log = LoggerFactory.getLogger(FingerprintEngine.class);

    static final Set<String> VOLATILE_KEYS = Set.of("_id", "_rev", "id", "createdAt", "updatedAt");

    private static final String DEFAULT_ALGORITHM = "SHA-256";

    private final ObjectMapper canonicalMapper;
    private final String algorithm;

    public FingerprintEngine() {
        this(DEFAULT_ALGORITHM);
    }

    FingerprintEngine(String algorithm) {
        this.algorithm = algorithm;
        this.canonicalMapper = JsonMapper.builder()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .build();
    }

    public String fingerprint(GenericEntity entity) {
        return hash(canonicalJson(entity));
    }

    String canonicalJson(GenericEntity entity) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        normalized.put("kind", entity.getKind().getLabel());
        normalized.put("subtype", entity.getSubtype());
        normalized.put("name", entity.getName());
        normalized.put("body", entity.getBody());
        normalized.put("stats", entity.getStats());
        normalized.put("tags", new ArrayList<>(new TreeSet<>(entity.getTags())));
        normalized.put("images", entity.getImages());
        normalized.put("metadata", sanitize(entity.getMetadata()));
        try {
            return canonicalMapper.writeValueAsString(normalized);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize entity " + entity.getSourceId() + " for fingerprinting", e);
        }
    }

    static Object sanitize(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> clean = new LinkedHashMap<>();
            map.forEach((k, v) -> {
                String key = String.valueOf(k);
                if (!VOLATILE_KEYS.contains(key)) {
                    clean.put(key, sanitize(v));
                }
            });
            return clean;
        }
        if (value instanceof List<?> list) {
            List<Object> clean = new ArrayList<>(list.size());
            list.forEach(v -> clean.add(sanitize(v)));
            return clean;
        }
        return value;
    }

    String hash(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance(algorithm);
            byte[] bytes = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(bytes.length * 2);
            for (byte b : bytes) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            log.warn("fingerprint.digest.unavailable algorithm={} fallback=fnv1a", algorithm);
            return fnv1a(input);
        }
    }

    static String fnv1a(String input) {
        int h = 0x811c9dc5;
        for (byte b : input.getBytes(StandardCharsets.UTF_8)) {
            h ^= (b & 0xff);
            h *= 0x01000193;
        }
        return String.format("%08x", h);
    }
}

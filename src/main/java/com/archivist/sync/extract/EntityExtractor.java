package com.archivist.sync.extract;

import com.archivist.sync.core.model.EntityKind;
import com.archivist.sync.core.model.EntityLink;
import com.archivist.sync.core.model.GenericEntity;
import com.archivist.sync.store.LocalRecord;
import com.archivist.sync.store.LocalStore;
import com.archivist.sync.store.TextPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Projects the records of a {@link LocalStore} into {@link GenericEntity} instances.
 *
 * <p>Every call re-reads the store, so extraction can simply be repeated after a failure.
 * Links are collected from the raw text before it is reduced to plain text.
 * A record that cannot be projected is logged and skipped.</p>
 */
public class EntityExtractor {
    private static final Logger log = LoggerFactory.getLogger(EntityExtractor.class);

    private static final Pattern UUID_LINK = Pattern.compile("@UUID\\[([^\\]]+)\\]");
    private static final Pattern JOURNAL_LINK = Pattern.compile("@JournalEntry\\[(.*?)\\]");

    private static final List<String> CHARACTER_DESCRIPTION_PATHS =
            List.of("biography.value", "biography.public", "description");
    private static final List<String> ITEM_DESCRIPTION_PATHS =
            List.of("description.value", "description");

    public List<GenericEntity> extract(LocalStore store) {
        return extract(store, 0);
    }

    /**
     * @param sampleLimit maximum number of entities to return; 0 or less means no limit
     */
    public List<GenericEntity> extract(LocalStore store, int sampleLimit) {
        List<GenericEntity> out = new ArrayList<>();
        collect(store.listCharacters(), this::fromCharacter, out);
        collect(store.listFactions(), r -> fromJournal(r, EntityKind.FACTION), out);
        collect(store.listFreeText(), r -> fromJournal(r, EntityKind.JOURNAL), out);
        collect(store.listItems(), this::fromItem, out);
        collect(store.listLocations(), this::fromLocation, out);
        log.debug("extract.done entities={} sampleLimit={}", out.size(), sampleLimit);
        if (sampleLimit > 0 && out.size() > sampleLimit) {
            return List.copyOf(out.subList(0, sampleLimit));
        }
        return out;
    }

    private void collect(List<LocalRecord> records, Function<LocalRecord, GenericEntity> projection,
                         List<GenericEntity> out) {
        for (LocalRecord record : records) {
            try {
                out.add(projection.apply(record));
            } catch (RuntimeException e) {
                log.warn("extract.skipped id={} name='{}' error={}", record.getId(), record.getName(), e.getMessage());
            }
        }
    }

    GenericEntity fromCharacter(LocalRecord record) {
        String raw = firstText(record, CHARACTER_DESCRIPTION_PATHS);
        GenericEntity.Builder builder = base(record, EntityKind.CHARACTER, record.getType(), raw)
                .stats(flattenStats(record.getAttributes()));
        record.getImage().ifPresent(builder::image);
        ValuePaths.resolveText(record.getAttributes(), "token.image").ifPresent(builder::image);
        return builder.build();
    }

    GenericEntity fromItem(LocalRecord record) {
        String raw = firstText(record, ITEM_DESCRIPTION_PATHS);
        GenericEntity.Builder builder = base(record, EntityKind.ITEM, record.getType(), raw);
        record.getImage().ifPresent(builder::image);
        return builder.build();
    }

    GenericEntity fromLocation(LocalRecord record) {
        String pins = pinText(record.getAttributes().get("notes"));
        GenericEntity.Builder builder = base(record, EntityKind.LOCATION, "scene", pins);
        String background = ValuePaths.resolveText(record.getAttributes(), "background").orElse(null);
        String thumbnail = ValuePaths.resolveText(record.getAttributes(), "thumbnail").orElse(null);
        builder.image(background != null ? background : record.getImage().orElse(null));
        builder.image(thumbnail);
        if (background != null) {
            builder.metadata("background", background);
        }
        return builder.build();
    }

    GenericEntity fromJournal(LocalRecord record, EntityKind kind) {
        List<String> texts = new ArrayList<>();
        List<String> pageImages = new ArrayList<>();
        for (TextPage page : record.getPages()) {
            if (page.hasText()) {
                texts.add(page.text());
            }
            if (page.image() != null) {
                pageImages.add(page.image());
            }
        }
        String raw = texts.isEmpty() ? record.getDescription() : String.join("\n\n", texts);
        GenericEntity.Builder builder = base(record, kind, kind == EntityKind.FACTION ? "faction" : "journal", raw)
                .metadata("pages", record.getPages().size());
        pageImages.forEach(builder::image);
        record.getImage().ifPresent(builder::image);
        return builder.build();
    }

    private GenericEntity.Builder base(LocalRecord record, EntityKind kind, String subtype, String rawText) {
        String raw = rawText != null ? rawText : "";
        GenericEntity.Builder builder = GenericEntity.builder()
                .kind(kind)
                .subtype(subtype)
                .name(record.getName())
                .sourceId(record.getId())
                .folderName(record.getFolderName())
                .links(collectLinks(raw))
                .body(TextNormalizer.toPlainText(raw));
        if (!record.getFolderName().isBlank()) {
            builder.tag(record.getFolderName().toLowerCase(Locale.ROOT));
        }
        TextNormalizer.hashtags(raw).forEach(builder::tag);
        if (!record.getType().isBlank()) {
            builder.metadata("type", record.getType());
        }
        if (!record.getAttributes().isEmpty()) {
            builder.metadata("system", record.getAttributes());
        }
        return builder;
    }

    static List<EntityLink> collectLinks(String text) {
        List<EntityLink> links = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return links;
        }
        Matcher uuid = UUID_LINK.matcher(text);
        while (uuid.find()) {
            links.add(new EntityLink(EntityLink.UUID_TYPE, uuid.group(1)));
        }
        Matcher journal = JOURNAL_LINK.matcher(text);
        while (journal.find()) {
            links.add(new EntityLink(EntityLink.JOURNAL_TYPE, journal.group(1)));
        }
        return links;
    }

    static Map<String, Object> flattenStats(Map<String, Object> attributes) {
        Map<String, Object> stats = new LinkedHashMap<>();
        firstValue(attributes, "hp.value", "hp").ifPresent(v -> stats.put("hp", numeric(v)));
        firstValue(attributes, "ac.value", "ac", "armorClass").ifPresent(v -> stats.put("ac", numeric(v)));
        firstValue(attributes, "level", "cr", "challenge").ifPresent(v -> stats.put("level", numeric(v)));
        ValuePaths.resolveText(attributes, "alignment").ifPresent(v -> stats.put("alignment", v));
        ValuePaths.resolveText(attributes, "race").ifPresent(v -> stats.put("race", v));
        ValuePaths.resolveText(attributes, "class").ifPresent(v -> stats.put("class", v));
        return stats;
    }

    private static Optional<String> firstValue(Map<String, Object> attributes, String... paths) {
        for (String path : paths) {
            Optional<String> value = ValuePaths.resolveText(attributes, path);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    private static Object numeric(String value) {
        try {
            double d = Double.parseDouble(value.trim());
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return (long) d;
            }
            return d;
        } catch (NumberFormatException e) {
            return value;
        }
    }

    private static String firstText(LocalRecord record, List<String> paths) {
        for (String path : paths) {
            Optional<String> value = ValuePaths.resolveText(record.getAttributes(), path);
            if (value.isPresent()) {
                return value.get();
            }
        }
        return record.getDescription();
    }

    private static String pinText(Object notes) {
        if (!(notes instanceof List<?> list)) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        for (Object note : list) {
            if (note instanceof Map<?, ?> map) {
                Object text = map.get("text");
                lines.add(text != null ? text.toString() : "");
            } else if (note != null) {
                lines.add(note.toString());
            }
        }
        return String.join("\n", lines);
    }
}

package com.archivist.sync.store;

import com.archivist.sync.core.model.MetadataValidationException;
import com.archivist.sync.core.model.OutboundBuckets;
import com.archivist.sync.core.model.RecordMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * In-memory implementation of {@link LocalStore}.
 * Suitable for testing and for hosts that project their own document model into it.
 * Records keep insertion order.
 */
public class InMemoryLocalStore implements LocalStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryLocalStore.class);

    private final Map<String, LocalRecord> records = new LinkedHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    /**
     * Stores a record as-is, replacing any record with the same id.
     */
    public synchronized LocalRecord put(LocalRecord record) {
        Objects.requireNonNull(record, "record");
        records.put(record.getId(), record);
        return record;
    }

    public synchronized int size() {
        return records.size();
    }

    @Override
    public List<LocalRecord> listCharacters() {
        return byKind(LocalRecordKind.CHARACTER);
    }

    @Override
    public List<LocalRecord> listItems() {
        return byKind(LocalRecordKind.ITEM);
    }

    @Override
    public List<LocalRecord> listLocations() {
        return byKind(LocalRecordKind.LOCATION);
    }

    @Override
    public List<LocalRecord> listFactions() {
        return byKind(LocalRecordKind.FACTION);
    }

    @Override
    public List<LocalRecord> listFreeText() {
        return byKind(LocalRecordKind.NOTE);
    }

    @Override
    public List<LocalRecord> listSheets() {
        return byKind(LocalRecordKind.SHEET);
    }

    @Override
    public synchronized Optional<LocalRecord> find(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public String createCharacter(NewRecord data) {
        return create(LocalRecordKind.CHARACTER, data);
    }

    @Override
    public String createItem(NewRecord data) {
        return create(LocalRecordKind.ITEM, data);
    }

    @Override
    public String createLocation(NewRecord data) {
        return create(LocalRecordKind.LOCATION, data);
    }

    @Override
    public String createSheet(NewRecord data) {
        return create(LocalRecordKind.SHEET, data);
    }

    @Override
    public void setCrossReference(String id, String remoteId, String campaignId) {
        updateMetadata(id, m -> m.toBuilder()
                .remoteId(remoteId)
                .remoteCampaignId(campaignId)
                .build());
    }

    @Override
    public void setRelationshipMetadata(String id, OutboundBuckets outbound, OutboundBuckets refs) {
        updateMetadata(id, m -> m.toBuilder()
                .relationshipOutbound(outbound)
                .relationshipRefs(refs)
                .build());
    }

    @Override
    public void setParentLocation(String id, String parentId) {
        updateMetadata(id, m -> m.toBuilder().parentLocationId(parentId).build());
    }

    @Override
    public void updateMetadata(String id, RecordMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata");
        updateMetadata(id, m -> metadata);
    }

    @Override
    public synchronized void rename(String id, String name) {
        Objects.requireNonNull(name, "name");
        LocalRecord record = require(id);
        records.put(id, record.withName(name));
    }

    @Override
    public synchronized boolean deleteSheet(String id) {
        LocalRecord record = records.get(id);
        if (record == null || record.getKind() != LocalRecordKind.SHEET) {
            return false;
        }
        records.remove(id);
        log.debug("store.sheet.deleted id={} name='{}'", id, record.getName());
        return true;
    }

    private synchronized String create(LocalRecordKind kind, NewRecord data) {
        String id = kind.getIdPrefix() + "-" + sequence.incrementAndGet();
        LocalRecord record = LocalRecord.builder()
                .id(id)
                .kind(kind)
                .name(data.name())
                .type(data.type())
                .folderName(data.folderName())
                .image(data.image())
                .description(data.body())
                .metadata(data.metadata())
                .build();
        checkParent(record, data.metadata());
        records.put(id, record);
        log.debug("store.created kind={} id={} name='{}'", kind, id, data.name());
        return id;
    }

    private synchronized void updateMetadata(String id, UnaryOperator<RecordMetadata> change) {
        LocalRecord record = require(id);
        RecordMetadata next = change.apply(record.getMetadata());
        checkParent(record, next);
        records.put(id, record.withMetadata(next));
    }

    private static void checkParent(LocalRecord record, RecordMetadata metadata) {
        String parent = metadata.getParentLocationId().orElse(null);
        if (parent == null) {
            return;
        }
        String entityId = metadata.getRemoteId().orElse(record.getId());
        if (parent.equals(entityId) || parent.equals(record.getId())) {
            throw new MetadataValidationException("Location cannot be its own parent: " + record.getId());
        }
    }

    private LocalRecord require(String id) {
        LocalRecord record = records.get(id);
        if (record == null) {
            throw new LocalRecordNotFoundException(id);
        }
        return record;
    }

    private synchronized List<LocalRecord> byKind(LocalRecordKind kind) {
        return records.values().stream()
                .filter(r -> r.getKind() == kind)
                .toList();
    }
}

package com.archivist.sync.store;

import com.archivist.sync.core.model.OutboundBuckets;
import com.archivist.sync.core.model.RecordMetadata;

import java.util.List;
import java.util.Optional;

/**
 * The live world store the engine reads from and writes back to.
 *
 * <p>Reads return snapshots; callers re-read after writing. Writes addressing an
 * unknown id throw {@link LocalRecordNotFoundException}.</p>
 */
public interface LocalStore {

    List<LocalRecord> listCharacters();

    List<LocalRecord> listItems();

    List<LocalRecord> listLocations();

    List<LocalRecord> listFactions();

    List<LocalRecord> listFreeText();

    /**
     * Journals created and owned by the sync engine (reference sheets and recaps).
     */
    List<LocalRecord> listSheets();

    Optional<LocalRecord> find(String id);

    String createCharacter(NewRecord data);

    String createItem(NewRecord data);

    String createLocation(NewRecord data);

    String createSheet(NewRecord data);

    /**
     * Binds a local record to its remote counterpart.
     */
    void setCrossReference(String id, String remoteId, String campaignId);

    void setRelationshipMetadata(String id, OutboundBuckets outbound, OutboundBuckets refs);

    /**
     * @param parentId the parent location entity id, or null to clear
     */
    void setParentLocation(String id, String parentId);

    void updateMetadata(String id, RecordMetadata metadata);

    void rename(String id, String name);

    /**
     * Removes an engine-owned sheet. Core records are never deleted by the engine.
     *
     * @return true if a sheet was removed
     */
    boolean deleteSheet(String id);

    default List<LocalRecord> list(LocalRecordKind kind) {
        return switch (kind) {
            case CHARACTER -> listCharacters();
            case ITEM -> listItems();
            case LOCATION -> listLocations();
            case FACTION -> listFactions();
            case NOTE -> listFreeText();
            case SHEET -> listSheets();
        };
    }

    default Optional<LocalRecord> findByRemoteId(LocalRecordKind kind, String remoteId) {
        if (remoteId == null) {
            return Optional.empty();
        }
        return list(kind).stream()
                .filter(r -> r.getRemoteId().filter(remoteId::equals).isPresent())
                .findFirst();
    }
}

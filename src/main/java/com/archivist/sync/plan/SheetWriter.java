package com.archivist.sync.plan;

import com.archivist.sync.core.model.RecordMetadata;
import com.archivist.sync.core.model.SheetType;
import com.archivist.sync.extract.TextNormalizer;
import com.archivist.sync.remote.RemoteEntity;
import com.archivist.sync.remote.RemoteEntityKind;
import com.archivist.sync.remote.RemoteSession;
import com.archivist.sync.store.LocalRecord;
import com.archivist.sync.store.LocalStore;
import com.archivist.sync.store.NewRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Creates and refreshes the engine-owned sheets: reference sheets for remote entities and
 * recap sheets for sessions. Sheets are found again by remote id and sheet type, so every
 * write here can be repeated.
 */
public class SheetWriter {
    private static final Logger log = LoggerFactory.getLogger(SheetWriter.class);

    public enum Change {
        CREATED,
        UPDATED,
        UNCHANGED
    }

    public record SheetWrite(String sheetId, Change change) {
    }

    private final LocalStore store;

    public SheetWriter(LocalStore store) {
        this.store = store;
    }

    public static SheetType sheetTypeFor(RemoteEntityKind kind, RemoteEntity entity) {
        return switch (kind) {
            case CHARACTER -> RemoteEntity.NPC.equals(entity.characterType()) ? SheetType.NPC : SheetType.PC;
            case ITEM -> SheetType.ITEM;
            case LOCATION -> SheetType.LOCATION;
            case FACTION -> SheetType.FACTION;
        };
    }

    static String folderFor(SheetType type) {
        return switch (type) {
            case PC -> "PCs";
            case NPC, CHARACTER -> "NPCs";
            case ITEM -> "Items";
            case LOCATION -> "Locations";
            case FACTION -> "Factions";
            case RECAP -> "Recaps";
        };
    }

    public Optional<LocalRecord> findSheet(String remoteId, Set<SheetType> types) {
        return store.listSheets().stream()
                .filter(r -> r.getRemoteId().filter(remoteId::equals).isPresent())
                .filter(r -> r.getMetadata().getSheetType().filter(types::contains).isPresent())
                .findFirst();
    }

    /**
     * Creates the reference sheet of a remote entity, or renames it when the remote name changed.
     */
    public SheetWrite ensureSheet(RemoteEntityKind kind, RemoteEntity entity, String campaignId) {
        Objects.requireNonNull(entity, "entity");
        Optional<LocalRecord> existing = findSheet(entity.id(), typesOf(kind));
        if (existing.isPresent()) {
            LocalRecord sheet = existing.get();
            if (!entity.name().isEmpty() && !entity.name().equals(sheet.getName())) {
                store.rename(sheet.getId(), entity.name());
                log.debug("sheet.renamed id={} from='{}' to='{}'", sheet.getId(), sheet.getName(), entity.name());
                return new SheetWrite(sheet.getId(), Change.UPDATED);
            }
            return new SheetWrite(sheet.getId(), Change.UNCHANGED);
        }

        SheetType type = sheetTypeFor(kind, entity);
        RecordMetadata.Builder metadata = RecordMetadata.builder()
                .sheetType(type)
                .remoteId(entity.id())
                .remoteCampaignId(campaignId);
        if (kind == RemoteEntityKind.LOCATION && entity.parentId() != null && !entity.parentId().equals(entity.id())) {
            metadata.parentLocationId(entity.parentId());
        }
        String id = store.createSheet(new NewRecord(entity.name(), type.getValue(), folderFor(type),
                entity.image(), entity.description(), metadata.build()));
        log.debug("sheet.created id={} type={} remoteId={}", id, type.getValue(), entity.id());
        return new SheetWrite(id, Change.CREATED);
    }

    /**
     * Creates the recap sheet of a session, or refreshes its title and date.
     */
    public SheetWrite upsertRecap(RemoteSession session, String campaignId) {
        Optional<LocalRecord> existing = findSheet(session.id(), EnumSet.of(SheetType.RECAP));
        if (existing.isPresent()) {
            LocalRecord sheet = existing.get();
            boolean changed = false;
            if (!session.title().equals(sheet.getName())) {
                store.rename(sheet.getId(), session.title());
                changed = true;
            }
            RecordMetadata metadata = sheet.getMetadata();
            if (!Objects.equals(metadata.getSessionDate().orElse(null), session.sessionDate())) {
                store.updateMetadata(sheet.getId(), metadata.toBuilder().sessionDate(session.sessionDate()).build());
                changed = true;
            }
            return new SheetWrite(sheet.getId(), changed ? Change.UPDATED : Change.UNCHANGED);
        }

        RecordMetadata metadata = RecordMetadata.builder()
                .sheetType(SheetType.RECAP)
                .remoteId(session.id())
                .remoteCampaignId(campaignId)
                .sessionDate(session.sessionDate())
                .build();
        String id = store.createSheet(new NewRecord(session.title(), SheetType.RECAP.getValue(),
                folderFor(SheetType.RECAP), null, TextNormalizer.toHtml(session.summary()), metadata));
        log.debug("sheet.recap.created id={} session={} date={}", id, session.id(), session.sessionDate());
        return new SheetWrite(id, Change.CREATED);
    }

    /**
     * Records the scene rendering a location on the location's sheet, creating the sheet if needed.
     */
    public String attachScene(RemoteEntity location, String sceneId, String campaignId) {
        String sheetId = ensureSheet(RemoteEntityKind.LOCATION, location, campaignId).sheetId();
        LocalRecord sheet = store.find(sheetId).orElseThrow();
        RecordMetadata metadata = sheet.getMetadata();
        store.updateMetadata(sheetId, metadata.toBuilder()
                .localCrossReferences(metadata.getLocalCrossReferences().withScene(sceneId))
                .build());
        return sheetId;
    }

    private static Set<SheetType> typesOf(RemoteEntityKind kind) {
        return switch (kind) {
            case CHARACTER -> EnumSet.of(SheetType.PC, SheetType.NPC, SheetType.CHARACTER);
            case ITEM -> EnumSet.of(SheetType.ITEM);
            case LOCATION -> EnumSet.of(SheetType.LOCATION);
            case FACTION -> EnumSet.of(SheetType.FACTION);
        };
    }
}

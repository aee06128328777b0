package com.archivist.sync.reset;

import com.archivist.sync.core.model.RecordMetadata;
import com.archivist.sync.link.LinkGraphIndexer;
import com.archivist.sync.store.LocalRecord;
import com.archivist.sync.store.LocalRecordKind;
import com.archivist.sync.store.LocalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Set;

/**
 * Removes what the sync engine wrote to the local store. Host data is left alone; running a
 * reset twice changes nothing the second time.
 */
public class SyncResetService {
    private static final Logger log = LoggerFactory.getLogger(SyncResetService.class);

    private static final Set<LocalRecordKind> CORE_KINDS = EnumSet.of(
            LocalRecordKind.CHARACTER, LocalRecordKind.ITEM, LocalRecordKind.LOCATION,
            LocalRecordKind.FACTION, LocalRecordKind.NOTE);

    private final LocalStore store;
    private final LinkGraphIndexer indexer;

    public SyncResetService(LocalStore store, LinkGraphIndexer indexer) {
        this.store = store;
        this.indexer = indexer;
    }

    public ResetResult reset(ResetMode mode) {
        int cleared = 0;
        for (LocalRecordKind kind : CORE_KINDS) {
            for (LocalRecord record : store.list(kind)) {
                if (!record.getMetadata().isEmpty()) {
                    store.updateMetadata(record.getId(), RecordMetadata.empty());
                    cleared++;
                }
            }
        }
        int removed = 0;
        if (mode == ResetMode.REMOVE_SHEETS) {
            for (LocalRecord sheet : store.listSheets()) {
                if (sheet.getMetadata().getSheetType().isPresent() && store.deleteSheet(sheet.getId())) {
                    removed++;
                }
            }
        }
        indexer.rebuild();
        log.info("reset.done mode={} recordsCleared={} sheetsRemoved={}", mode, cleared, removed);
        return new ResetResult(cleared, removed);
    }
}

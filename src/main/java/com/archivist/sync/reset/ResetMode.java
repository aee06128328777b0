package com.archivist.sync.reset;

public enum ResetMode {
    /** Clear sync metadata on core records; keep engine-owned sheets. */
    METADATA_ONLY,
    /** Clear sync metadata and delete engine-owned sheets. */
    REMOVE_SHEETS
}

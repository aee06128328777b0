package com.archivist.sync.importer;

import com.archivist.sync.core.model.GenericEntity;
import com.archivist.sync.core.model.MappingProposal;

/**
 * A corrected proposal as the user would review it before running an import.
 *
 * @param include false when a per-record correction excludes the entity
 */
public record ImportPreview(GenericEntity entity, MappingProposal proposal, boolean include) {
}

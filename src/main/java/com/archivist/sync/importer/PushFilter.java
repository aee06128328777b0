package com.archivist.sync.importer;

import com.archivist.sync.core.model.EntityKind;
import com.archivist.sync.core.model.GenericEntity;
import com.archivist.sync.core.model.MappingProposal;
import com.archivist.sync.core.model.TargetType;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Selects the entities pushed by {@link ImporterService#pushFiltered(PushFilter)}.
 * Empty criteria match everything.
 *
 * @param kinds         entity kinds to include; empty for all
 * @param targetType    required target type after corrections, or null
 * @param folderPattern case-insensitive regex the folder name must contain, or null
 */
public record PushFilter(Set<EntityKind> kinds, TargetType targetType, String folderPattern) {

    public PushFilter {
        kinds = kinds != null ? Set.copyOf(kinds) : Set.of();
    }

    public static PushFilter all() {
        return new PushFilter(null, null, null);
    }

    public static PushFilter of(TargetType targetType) {
        return new PushFilter(null, targetType, null);
    }

    boolean acceptsEntity(GenericEntity entity) {
        if (!kinds.isEmpty() && !kinds.contains(entity.getKind())) {
            return false;
        }
        if (folderPattern != null && !entity.getFolderName().isEmpty()) {
            return Pattern.compile(folderPattern, Pattern.CASE_INSENSITIVE).matcher(entity.getFolderName()).find();
        }
        return true;
    }

    boolean acceptsProposal(MappingProposal proposal) {
        return targetType == null || proposal.targetType() == targetType;
    }
}

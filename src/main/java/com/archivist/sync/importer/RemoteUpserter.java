package com.archivist.sync.importer;

import com.archivist.sync.core.model.MappingProposal;
import com.archivist.sync.core.model.TargetType;
import com.archivist.sync.extract.TextNormalizer;
import com.archivist.sync.remote.DescriptionTooLongException;
import com.archivist.sync.remote.RemoteCampaignService;
import com.archivist.sync.remote.RemoteEntity;
import com.archivist.sync.remote.RemoteEntityKind;
import com.archivist.sync.remote.RemotePayload;
import com.archivist.sync.remote.RemoteServiceException;
import com.archivist.sync.store.LocalRecord;
import com.archivist.sync.store.LocalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Writes a mapping proposal to the remote service.
 *
 * <p>A record already bound to the campaign is updated; if the update fails the record is
 * created instead and the new id written back. Unbound records are created. Notes are not
 * upserted.</p>
 */
public class RemoteUpserter {
    private static final Logger log = LoggerFactory.getLogger(RemoteUpserter.class);

    public enum Outcome {
        CREATED,
        UPDATED,
        NOT_SUPPORTED
    }

    public record UpsertResult(Outcome outcome, String remoteId) {
    }

    private final RemoteCampaignService remote;
    private final LocalStore store;

    public RemoteUpserter(RemoteCampaignService remote, LocalStore store) {
        this.remote = remote;
        this.store = store;
    }

    /**
     * @throws RemoteServiceException       if the create call fails
     * @throws DescriptionTooLongException if the description exceeds the remote limit
     */
    public UpsertResult upsert(LocalRecord source, MappingProposal proposal, String campaignId) {
        Optional<RemoteEntityKind> kind = remoteKind(proposal.targetType());
        if (kind.isEmpty()) {
            log.debug("import.upsert.unsupported source={} target={}", source.getId(), proposal.targetType());
            return new UpsertResult(Outcome.NOT_SUPPORTED, null);
        }
        RemotePayload payload = buildPayload(source, proposal, campaignId);
        String existingId = source.getMetadata().isBoundTo(campaignId)
                ? source.getMetadata().getRemoteId().orElse(null) : null;

        if (existingId != null) {
            try {
                remote.update(kind.get(), existingId, payload);
                return new UpsertResult(Outcome.UPDATED, existingId);
            } catch (RemoteServiceException e) {
                log.warn("import.update.failed source={} remoteId={} status={} fallback=create",
                        source.getId(), existingId, e.getStatusCode());
            }
        }
        String createdId = remote.create(kind.get(), payload);
        store.setCrossReference(source.getId(), createdId, campaignId);
        return new UpsertResult(Outcome.CREATED, createdId);
    }

    static Optional<RemoteEntityKind> remoteKind(TargetType targetType) {
        return switch (targetType) {
            case CHARACTER -> Optional.of(RemoteEntityKind.CHARACTER);
            case ITEM -> Optional.of(RemoteEntityKind.ITEM);
            case LOCATION -> Optional.of(RemoteEntityKind.LOCATION);
            case FACTION -> Optional.of(RemoteEntityKind.FACTION);
            case NOTE -> Optional.empty();
        };
    }

    static RemotePayload buildPayload(LocalRecord source, MappingProposal proposal, String campaignId) {
        Map<String, String> p = proposal.payload();
        TargetType target = proposal.targetType();
        RemotePayload.Builder builder = RemotePayload.builder()
                .campaignId(campaignId)
                .description(TextNormalizer.toMarkdown(coalesce(p.get("description"))));
        if (target == TargetType.CHARACTER) {
            return builder
                    .name(coalesce(p.get("character_name"), p.get("title"), p.get("name"), source.getName(), "Character"))
                    .type(characterType(source, proposal))
                    .image(coalesce(p.get("portraitUrl"), p.get("imageUrl"), p.get("image")))
                    .build();
        }
        return builder
                .name(coalesce(p.get("name"), p.get("title"), source.getName(), target.getLabel()))
                .image(coalesce(p.get("imageUrl"), p.get("image")))
                .build();
    }

    /**
     * PC or NPC label first, then the host type: {@code character} is a PC, anything else an NPC.
     */
    static String characterType(LocalRecord source, MappingProposal proposal) {
        if (proposal.hasLabel(RemoteEntity.PC)) {
            return RemoteEntity.PC;
        }
        if (proposal.hasLabel(RemoteEntity.NPC)) {
            return RemoteEntity.NPC;
        }
        return "character".equalsIgnoreCase(source.getType()) ? RemoteEntity.PC : RemoteEntity.NPC;
    }

    private static String coalesce(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}

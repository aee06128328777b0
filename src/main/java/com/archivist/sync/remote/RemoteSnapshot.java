package com.archivist.sync.remote;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Everything the remote service holds for one campaign, read once.
 */
public record RemoteSnapshot(
        String campaignId,
        List<RemoteEntity> characters,
        List<RemoteEntity> items,
        List<RemoteEntity> locations,
        List<RemoteEntity> factions,
        List<RemoteSession> sessions,
        List<RemoteLink> links
) {
    private static final Logger log = LoggerFactory.getLogger(RemoteSnapshot.class);

    public RemoteSnapshot {
        characters = characters != null ? List.copyOf(characters) : List.of();
        items = items != null ? List.copyOf(items) : List.of();
        locations = locations != null ? List.copyOf(locations) : List.of();
        factions = factions != null ? List.copyOf(factions) : List.of();
        sessions = sessions != null ? List.copyOf(sessions) : List.of();
        links = links != null ? List.copyOf(links) : List.of();
    }

    public static RemoteSnapshot empty(String campaignId) {
        return new RemoteSnapshot(campaignId, null, null, null, null, null, null);
    }

    /**
     * Reads all collections of a campaign.
     *
     * @throws RemoteServiceException if any list call fails
     */
    public static RemoteSnapshot load(RemoteCampaignService service, String campaignId) {
        RemoteSnapshot snapshot = new RemoteSnapshot(
                campaignId,
                service.listCharacters(campaignId),
                service.listItems(campaignId),
                service.listLocations(campaignId),
                service.listFactions(campaignId),
                service.listSessions(campaignId),
                service.listLinks(campaignId));
        log.info("remote.snapshot campaign={} characters={} items={} locations={} factions={} sessions={} links={}",
                campaignId, snapshot.characters.size(), snapshot.items.size(), snapshot.locations.size(),
                snapshot.factions.size(), snapshot.sessions.size(), snapshot.links.size());
        return snapshot;
    }

    public List<RemoteEntity> entities(RemoteEntityKind kind) {
        return switch (kind) {
            case CHARACTER -> characters;
            case ITEM -> items;
            case LOCATION -> locations;
            case FACTION -> factions;
        };
    }

    public Optional<RemoteEntity> find(RemoteEntityKind kind, String id) {
        return entities(kind).stream().filter(e -> e.id().equals(id)).findFirst();
    }
}

package com.archivist.sync.remote;

import java.util.List;

/**
 * The remote system of record.
 *
 * <p>Every method may throw {@link RemoteServiceException}; create and update
 * methods throw {@link DescriptionTooLongException} when the payload description
 * exceeds {@link #descriptionLimit()}.</p>
 */
public interface RemoteCampaignService {

    int DEFAULT_DESCRIPTION_LIMIT = 10_000;

    List<RemoteEntity> listCharacters(String campaignId);

    List<RemoteEntity> listItems(String campaignId);

    List<RemoteEntity> listLocations(String campaignId);

    List<RemoteEntity> listFactions(String campaignId);

    List<RemoteSession> listSessions(String campaignId);

    List<RemoteLink> listLinks(String campaignId);

    /**
     * @return the id of the created record
     */
    String createCharacter(RemotePayload payload);

    String createItem(RemotePayload payload);

    String createLocation(RemotePayload payload);

    String createFaction(RemotePayload payload);

    String createLink(RemoteLinkPayload payload);

    void updateCharacter(String id, RemotePayload payload);

    void updateItem(String id, RemotePayload payload);

    void updateLocation(String id, RemotePayload payload);

    void updateFaction(String id, RemotePayload payload);

    /**
     * Changes only the parent of a location.
     *
     * @param parentId remote id of the new parent, or null to make the location a root
     */
    void updateLocationParent(String id, String parentId);

    void deleteLink(String id);

    default int descriptionLimit() {
        return DEFAULT_DESCRIPTION_LIMIT;
    }

    default List<RemoteEntity> list(RemoteEntityKind kind, String campaignId) {
        return switch (kind) {
            case CHARACTER -> listCharacters(campaignId);
            case ITEM -> listItems(campaignId);
            case LOCATION -> listLocations(campaignId);
            case FACTION -> listFactions(campaignId);
        };
    }

    default String create(RemoteEntityKind kind, RemotePayload payload) {
        return switch (kind) {
            case CHARACTER -> createCharacter(payload);
            case ITEM -> createItem(payload);
            case LOCATION -> createLocation(payload);
            case FACTION -> createFaction(payload);
        };
    }

    default void update(RemoteEntityKind kind, String id, RemotePayload payload) {
        switch (kind) {
            case CHARACTER -> updateCharacter(id, payload);
            case ITEM -> updateItem(id, payload);
            case LOCATION -> updateLocation(id, payload);
            case FACTION -> updateFaction(id, payload);
        }
    }
}

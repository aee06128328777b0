package com.archivist.sync.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * {@link RemoteCampaignService} over the campaign service's REST API, using the JDK HTTP client and Jackson.
 *
 * <p>Lists are fetched page by page ({@code ?world_id=&page=&size=}) until the
 * envelope's {@code pages} count is reached or a short page is returned. Responses
 * may be either an envelope {@code {"data": [...], "pages": n}} or a bare array.</p>
 *
 * Usage:
 * <pre>
 * RemoteCampaignService remote = HttpRemoteCampaignService.builder()
 *     .baseUrl("https://api.example.com/v1")
 *     .apiKey(key)
 *     .build();
 * </pre>
 */
public class HttpRemoteCampaignService implements RemoteCampaignService {
    private static final Logger log = LoggerFactory.getLogger(HttpRemoteCampaignService.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    private static final int DEFAULT_PAGE_SIZE = 100;
    private static final String API_KEY_HEADER = "x-api-key";

    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;
    private final int pageSize;
    private final int descriptionLimit;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private HttpRemoteCampaignService(Builder builder) {
        this.baseUrl = stripTrailingSlash(builder.baseUrl);
        this.apiKey = builder.apiKey != null ? builder.apiKey : "";
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.pageSize = builder.pageSize > 0 ? builder.pageSize : DEFAULT_PAGE_SIZE;
        this.descriptionLimit = builder.descriptionLimit > 0 ? builder.descriptionLimit : DEFAULT_DESCRIPTION_LIMIT;
        this.httpClient = builder.httpClient != null ? builder.httpClient
                : HttpClient.newBuilder().connectTimeout(timeout).build();
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
    }

    @Override
    public List<RemoteEntity> listCharacters(String campaignId) {
        return listAll(RemoteEntityKind.CHARACTER.getPath(), campaignId, node -> new RemoteEntity(
                node.path("id").asText(),
                firstText(node, "character_name", "name"),
                firstText(node, "type", "character_type"),
                text(node, "description"),
                text(node, "image"),
                null));
    }

    @Override
    public List<RemoteEntity> listItems(String campaignId) {
        return listAll(RemoteEntityKind.ITEM.getPath(), campaignId, this::toEntity);
    }

    @Override
    public List<RemoteEntity> listLocations(String campaignId) {
        return listAll(RemoteEntityKind.LOCATION.getPath(), campaignId, this::toEntity);
    }

    @Override
    public List<RemoteEntity> listFactions(String campaignId) {
        return listAll(RemoteEntityKind.FACTION.getPath(), campaignId, this::toEntity);
    }

    @Override
    public List<RemoteSession> listSessions(String campaignId) {
        return listAll("/sessions", campaignId, node -> new RemoteSession(
                node.path("id").asText(),
                text(node, "title"),
                text(node, "summary"),
                text(node, "session_date")));
    }

    @Override
    public List<RemoteLink> listLinks(String campaignId) {
        return listAll("/links", campaignId, node -> new RemoteLink(
                text(node, "id"),
                node.path("from_id").asText(),
                text(node, "from_type"),
                node.path("to_id").asText(),
                text(node, "to_type")));
    }

    @Override
    public String createCharacter(RemotePayload payload) {
        return sendCreate(RemoteEntityKind.CHARACTER, payload);
    }

    @Override
    public String createItem(RemotePayload payload) {
        return sendCreate(RemoteEntityKind.ITEM, payload);
    }

    @Override
    public String createLocation(RemotePayload payload) {
        return sendCreate(RemoteEntityKind.LOCATION, payload);
    }

    @Override
    public String createFaction(RemotePayload payload) {
        return sendCreate(RemoteEntityKind.FACTION, payload);
    }

    @Override
    public String createLink(RemoteLinkPayload payload) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("campaign_id", payload.campaignId());
        body.put("from_id", payload.fromId());
        body.put("from_type", payload.fromType());
        body.put("to_id", payload.toId());
        body.put("to_type", payload.toType());
        JsonNode response = send("POST", "/links", body);
        return extractId(response, "/links");
    }

    @Override
    public void updateCharacter(String id, RemotePayload payload) {
        sendUpdate(RemoteEntityKind.CHARACTER, id, payload);
    }

    @Override
    public void updateItem(String id, RemotePayload payload) {
        sendUpdate(RemoteEntityKind.ITEM, id, payload);
    }

    @Override
    public void updateLocation(String id, RemotePayload payload) {
        sendUpdate(RemoteEntityKind.LOCATION, id, payload);
    }

    @Override
    public void updateFaction(String id, RemotePayload payload) {
        sendUpdate(RemoteEntityKind.FACTION, id, payload);
    }

    @Override
    public void updateLocationParent(String id, String parentId) {
        Objects.requireNonNull(id, "id is required");
        ObjectNode body = objectMapper.createObjectNode();
        if (parentId != null) {
            body.put("parent_id", parentId);
        } else {
            body.putNull("parent_id");
        }
        send("PATCH", RemoteEntityKind.LOCATION.getPath() + "/" + encode(id), body);
        log.debug("remote.location.parent id={} parent={}", id, parentId);
    }

    @Override
    public void deleteLink(String id) {
        send("DELETE", "/links/" + encode(id), null);
    }

    @Override
    public int descriptionLimit() {
        return descriptionLimit;
    }

    private String sendCreate(RemoteEntityKind kind, RemotePayload payload) {
        checkDescription(payload);
        JsonNode response = send("POST", kind.getPath(), toBody(kind, payload));
        String id = extractId(response, kind.getPath());
        log.debug("remote.created kind={} id={} name='{}'", kind, id, payload.getName());
        return id;
    }

    private void sendUpdate(RemoteEntityKind kind, String id, RemotePayload payload) {
        Objects.requireNonNull(id, "id is required");
        checkDescription(payload);
        send("PUT", kind.getPath() + "/" + encode(id), toBody(kind, payload));
        log.debug("remote.updated kind={} id={}", kind, id);
    }

    private void checkDescription(RemotePayload payload) {
        int length = payload.descriptionLength();
        if (length > descriptionLimit) {
            throw new DescriptionTooLongException(length, descriptionLimit);
        }
    }

    private ObjectNode toBody(RemoteEntityKind kind, RemotePayload payload) {
        ObjectNode body = objectMapper.createObjectNode();
        if (kind == RemoteEntityKind.CHARACTER) {
            body.put("character_name", payload.getName());
            payload.getType().ifPresent(t -> body.put("type", t));
        } else {
            body.put("name", payload.getName());
        }
        body.put("campaign_id", payload.getCampaignId());
        payload.getDescription().ifPresent(d -> body.put("description", d));
        payload.getImage().ifPresent(i -> body.put("image", i));
        payload.getParentId().ifPresent(p -> body.put("parent_id", p));
        return body;
    }

    private <T> List<T> listAll(String path, String campaignId, Function<JsonNode, T> mapper) {
        Objects.requireNonNull(campaignId, "campaignId is required");
        List<T> all = new ArrayList<>();
        int page = 1;
        while (true) {
            String query = path + "?world_id=" + encode(campaignId) + "&page=" + page + "&size=" + pageSize;
            JsonNode data = send("GET", query, null);
            JsonNode items = data.isArray() ? data : data.path("data");
            int count = 0;
            if (items.isArray()) {
                for (JsonNode node : items) {
                    all.add(mapper.apply(node));
                    count++;
                }
            }
            int totalPages = data.path("pages").isNumber()
                    ? data.path("pages").asInt()
                    : (count < pageSize ? page : page + 1);
            if (page >= totalPages || count < pageSize) {
                break;
            }
            page++;
        }
        log.debug("remote.list path={} campaign={} count={} pages={}", path, campaignId, all.size(), page);
        return all;
    }

    private JsonNode send(String method, String path, JsonNode body) {
        HttpRequest.BodyPublisher publisher;
        try {
            publisher = body != null
                    ? HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body))
                    : HttpRequest.BodyPublishers.noBody();
        } catch (JsonProcessingException e) {
            throw new RemoteServiceException("Failed to serialize request for " + path, 0, e);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header(API_KEY_HEADER, apiKey)
                .method(method, publisher)
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RemoteServiceException(method + " " + path + " failed: " + e.getMessage(), 0, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteServiceException(method + " " + path + " interrupted", 0, e);
        }

        int status = response.statusCode();
        String responseBody = response.body() != null ? response.body() : "";
        if (status >= 400) {
            log.warn("remote.request.failed method={} path={} status={}", method, path, status);
            if (isDescriptionRejection(status, responseBody)) {
                throw new DescriptionTooLongException("Remote service rejected description: " + responseBody);
            }
            throw new RemoteServiceException(
                    "Remote service returned status " + status + " for " + method + " " + path + ": " + responseBody,
                    status);
        }
        if (responseBody.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new RemoteServiceException("Unparseable response for " + method + " " + path, status, e);
        }
    }

    static boolean isDescriptionRejection(int status, String body) {
        if (status == 413) {
            return true;
        }
        if (status != 422) {
            return false;
        }
        String lower = body.toLowerCase(Locale.ROOT);
        return lower.contains("description") && (lower.contains("length") || lower.contains("too long"));
    }

    private static String extractId(JsonNode response, String path) {
        JsonNode id = response.path("id");
        if (id.isMissingNode() || id.isNull()) {
            id = response.path("data").path("id");
        }
        if (id.isMissingNode() || id.isNull() || id.asText().isBlank()) {
            throw new RemoteServiceException("Create response for " + path + " carries no id");
        }
        return id.asText();
    }

    private RemoteEntity toEntity(JsonNode node) {
        return new RemoteEntity(
                node.path("id").asText(),
                firstText(node, "name", "title"),
                null,
                text(node, "description"),
                text(node, "image"),
                text(node, "parent_id"));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String url) {
        Objects.requireNonNull(url, "baseUrl is required");
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String apiKey;
        private Duration timeout;
        private int pageSize;
        private int descriptionLimit;
        private HttpClient httpClient;
        private ObjectMapper objectMapper;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder pageSize(int pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        public Builder descriptionLimit(int descriptionLimit) {
            this.descriptionLimit = descriptionLimit;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public HttpRemoteCampaignService build() {
            Objects.requireNonNull(baseUrl, "baseUrl is required");
            return new HttpRemoteCampaignService(this);
        }
    }
}

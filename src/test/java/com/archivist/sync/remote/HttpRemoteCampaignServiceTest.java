package com.archivist.sync.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class HttpRemoteCampaignServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private HttpServer server;
    private HttpRemoteCampaignService service;

    /** Canned responses keyed by "METHOD path?query". */
    private final Map<String, Response> responses = new ConcurrentHashMap<>();
    private final List<Recorded> requests = new CopyOnWriteArrayList<>();

    private record Response(int status, String body) {
    }

    private record Recorded(String method, String uri, String apiKey, String body) {
    }

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
        service = HttpRemoteCampaignService.builder()
                .baseUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/v1/")
                .apiKey("secret")
                .pageSize(2)
                .descriptionLimit(20)
                .httpClient(HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build())
                .build();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        String uri = exchange.getRequestURI().toString();
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        requests.add(new Recorded(exchange.getRequestMethod(), uri,
                exchange.getRequestHeaders().getFirst("x-api-key"), body));
        Response response = responses.getOrDefault(exchange.getRequestMethod() + " " + uri,
                new Response(404, "{\"error\":\"not found\"}"));
        byte[] bytes = response.body().getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(response.status(), bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
        exchange.close();
    }

    private void respond(String method, String uri, int status, String body) {
        responses.put(method + " /v1" + uri, new Response(status, body));
    }

    private JsonNode lastBody() throws IOException {
        return objectMapper.readTree(requests.get(requests.size() - 1).body());
    }

    @Nested
    @DisplayName("Listing")
    class Listing {

        @Test
        @DisplayName("Should follow the page count of the envelope")
        void testPagedEnvelope() {
            respond("GET", "/characters?world_id=c-1&page=1&size=2", 200,
                    "{\"data\":[{\"id\":\"r-1\",\"character_name\":\"Mira\",\"type\":\"NPC\"},"
                            + "{\"id\":\"r-2\",\"name\":\"Bran\"}],\"pages\":2}");
            respond("GET", "/characters?world_id=c-1&page=2&size=2", 200,
                    "{\"data\":[{\"id\":\"r-3\",\"character_name\":\"Ola\",\"character_type\":\"pc\"}],\"pages\":2}");

            List<RemoteEntity> characters = service.listCharacters("c-1");

            assertEquals(3, characters.size());
            assertEquals("Mira", characters.get(0).name());
            assertEquals("Bran", characters.get(1).name());
            assertEquals("PC", characters.get(1).characterType());
            assertEquals("pc", characters.get(2).type());
            assertEquals("secret", requests.get(0).apiKey());
        }

        @Test
        @DisplayName("Should accept a bare array and stop on a short page")
        void testBareArray() {
            respond("GET", "/locations?world_id=c-1&page=1&size=2", 200,
                    "[{\"id\":\"l-2\",\"title\":\"Cellar\",\"parent_id\":\"l-1\",\"description\":null}]");

            List<RemoteEntity> locations = service.listLocations("c-1");

            assertEquals(1, locations.size());
            assertEquals("Cellar", locations.get(0).name());
            assertEquals("l-1", locations.get(0).parentId());
            assertEquals("", locations.get(0).description());
            assertEquals(1, requests.size());
        }

        @Test
        @DisplayName("Should map sessions and links")
        void testSessionsAndLinks() {
            respond("GET", "/sessions?world_id=c-1&page=1&size=2", 200,
                    "[{\"id\":\"s-1\",\"title\":\"First\",\"summary\":\"Arrived\",\"session_date\":\"2026-01-10\"}]");
            respond("GET", "/links?world_id=c-1&page=1&size=2", 200,
                    "[{\"id\":\"k-1\",\"from_id\":\"r-1\",\"from_type\":\"Character\",\"to_id\":\"i-1\",\"to_type\":\"Item\"}]");

            RemoteSession session = service.listSessions("c-1").get(0);
            RemoteLink link = service.listLinks("c-1").get(0);

            assertEquals("2026-01-10", session.sessionDate());
            assertEquals("Arrived", session.summary());
            assertEquals("i-1", link.toId());
            assertEquals("Character", link.fromType());
        }

        @Test
        @DisplayName("Error statuses should surface as remote service errors")
        void testErrorStatus() {
            respond("GET", "/items?world_id=c-1&page=1&size=2", 503, "busy");

            RemoteServiceException e = assertThrows(RemoteServiceException.class, () -> service.listItems("c-1"));

            assertEquals(503, e.getStatusCode());
            assertFalse(e.isClientError());
        }
    }

    @Nested
    @DisplayName("Writes")
    class Writes {

        @Test
        @DisplayName("Creating a character should send the character fields and return the id")
        void testCreateCharacter() throws IOException {
            respond("POST", "/characters", 201, "{\"data\":{\"id\":\"r-9\"}}");

            String id = service.createCharacter(RemotePayload.builder()
                    .campaignId("c-1")
                    .name("Tess")
                    .type("PC")
                    .description("A bard")
                    .image("https://img/tess.png")
                    .build());

            assertEquals("r-9", id);
            JsonNode body = lastBody();
            assertEquals("Tess", body.path("character_name").asText());
            assertEquals("PC", body.path("type").asText());
            assertEquals("c-1", body.path("campaign_id").asText());
            assertEquals("https://img/tess.png", body.path("image").asText());
            assertTrue(body.path("name").isMissingNode());
        }

        @Test
        @DisplayName("Updating a location should PUT its parent")
        void testUpdateLocation() throws IOException {
            respond("PUT", "/locations/l-2", 200, "");

            service.updateLocation("l-2", RemotePayload.builder()
                    .campaignId("c-1")
                    .name("Cellar")
                    .parentId("l-1")
                    .build());

            assertEquals("PUT", requests.get(0).method());
            JsonNode body = lastBody();
            assertEquals("Cellar", body.path("name").asText());
            assertEquals("l-1", body.path("parent_id").asText());
            assertTrue(body.path("description").isMissingNode());
        }

        @Test
        @DisplayName("Kind-based create and update should reach the entity endpoints")
        void testKindDispatch() throws IOException {
            respond("POST", "/items", 201, "{\"id\":\"i-9\"}");
            respond("PUT", "/factions/f-1", 200, "{}");
            RemoteCampaignService remote = service;

            String id = remote.create(RemoteEntityKind.ITEM, RemotePayload.builder().campaignId("c-1").name("Rope").build());
            remote.update(RemoteEntityKind.FACTION, "f-1", RemotePayload.builder().campaignId("c-1").name("Guild").build());

            assertEquals("i-9", id);
            assertEquals("POST", requests.get(0).method());
            assertEquals("/v1/factions/f-1", requests.get(1).uri());
            assertEquals("Guild", lastBody().path("name").asText());
        }

        @Test
        @DisplayName("Parent changes should PATCH only the parent, null included")
        void testUpdateLocationParent() throws IOException {
            respond("PATCH", "/locations/l-2", 200, "{}");

            service.updateLocationParent("l-2", "l-1");
            assertEquals("l-1", lastBody().path("parent_id").asText());

            service.updateLocationParent("l-2", null);
            JsonNode cleared = lastBody();
            assertTrue(cleared.has("parent_id"));
            assertTrue(cleared.path("parent_id").isNull());
            assertEquals(1, cleared.size());
            assertEquals("PATCH", requests.get(1).method());
        }

        @Test
        @DisplayName("Long descriptions should be refused before sending")
        void testDescriptionTooLongLocally() {
            RemotePayload payload = RemotePayload.builder()
                    .campaignId("c-1")
                    .name("Rope")
                    .description("x".repeat(21))
                    .build();

            DescriptionTooLongException e = assertThrows(DescriptionTooLongException.class,
                    () -> service.createItem(payload));

            assertEquals(20, e.getLimit());
            assertTrue(requests.isEmpty());
        }

        @Test
        @DisplayName("A 413 from the remote should be reported as a description rejection")
        void testDescriptionTooLongRemotely() {
            respond("POST", "/factions", 413, "payload too large");

            assertThrows(DescriptionTooLongException.class, () -> service.createFaction(RemotePayload.builder()
                    .campaignId("c-1")
                    .name("Guild")
                    .build()));
        }

        @Test
        @DisplayName("A create response without an id should fail")
        void testMissingId() {
            respond("POST", "/items", 201, "{}");

            assertThrows(RemoteServiceException.class, () -> service.createItem(RemotePayload.builder()
                    .campaignId("c-1")
                    .name("Rope")
                    .build()));
        }

        @Test
        @DisplayName("Links should be created and deleted")
        void testLinks() throws IOException {
            respond("POST", "/links", 201, "{\"id\":\"k-1\"}");
            respond("DELETE", "/links/k-1", 204, "");

            String id = service.createLink(new RemoteLinkPayload("c-1", "r-1", "Character", "i-1", "Item"));
            JsonNode body = lastBody();
            service.deleteLink(id);

            assertEquals("k-1", id);
            assertEquals("Item", body.path("to_type").asText());
            assertEquals("DELETE", requests.get(1).method());
        }
    }

    @Test
    @DisplayName("Only 413 and description-related 422 responses are description rejections")
    void testIsDescriptionRejection() {
        assertTrue(HttpRemoteCampaignService.isDescriptionRejection(413, ""));
        assertTrue(HttpRemoteCampaignService.isDescriptionRejection(422, "Description exceeds maximum length"));
        assertFalse(HttpRemoteCampaignService.isDescriptionRejection(422, "name is required"));
        assertFalse(HttpRemoteCampaignService.isDescriptionRejection(400, "description too long"));
    }
}

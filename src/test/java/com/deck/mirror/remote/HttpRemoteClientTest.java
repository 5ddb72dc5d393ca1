package com.deck.mirror.remote;

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
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Base64;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class HttpRemoteClientTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private HttpServer server;
    private final Deque<Response> responses = new ArrayDeque<>();
    private final List<Recorded> requests = new CopyOnWriteArrayList<>();

    private record Response(int status, String body) {}

    private record Recorded(String method, String uri, String authorization, String body) {}

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        requests.add(new Recorded(exchange.getRequestMethod(), exchange.getRequestURI().toString(),
                exchange.getRequestHeaders().getFirst("Authorization"), body));
        Response response;
        synchronized (responses) {
            response = responses.isEmpty() ? new Response(500, "no response queued") : responses.poll();
        }
        byte[] bytes = response.body().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(response.status(), bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            exchange.getResponseBody().write(bytes);
        }
        exchange.close();
    }

    private void enqueue(int status, String body) {
        synchronized (responses) {
            responses.add(new Response(status, body));
        }
    }

    private HttpRemoteClient client() {
        return HttpRemoteClient.builder()
                .baseUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/api/")
                .apiKey("secret")
                .timeout(Duration.ofSeconds(5))
                .pageSize(2)
                .build();
    }

    @Nested
    @DisplayName("Decks")
    class DeckTests {

        @Test
        @DisplayName("Should list decks with basic authentication")
        void testListDecks() {
            enqueue(200, "{\"docs\":[{\"id\":\"AbCd1234\",\"name\":\"Python\",\"extra\":1}],\"bookmark\":\"x\"}");

            List<RemoteDeck> decks = client().listDecks();

            assertEquals(List.of(new RemoteDeck("AbCd1234", "Python")), decks);
            Recorded request = requests.get(0);
            assertEquals("GET", request.method());
            assertEquals("/api/decks/", request.uri());
            String expected = "Basic " + Base64.getEncoder().encodeToString("secret:".getBytes(StandardCharsets.UTF_8));
            assertEquals(expected, request.authorization());
        }

        @Test
        @DisplayName("Should create a deck by name")
        void testCreateDeck() throws Exception {
            enqueue(200, "{\"id\":\"NeWd1234\",\"name\":\"Rust\"}");

            RemoteDeck deck = client().createDeck("Rust");

            assertEquals("NeWd1234", deck.id());
            assertEquals("POST", requests.get(0).method());
            assertEquals("Rust", mapper.readTree(requests.get(0).body()).get("name").asText());
        }
    }

    @Nested
    @DisplayName("Card listing")
    class ListCardsTests {

        @Test
        @DisplayName("Should follow bookmarks until an empty page")
        void testPagination() {
            enqueue(200, "{\"docs\":[{\"id\":\"c1\",\"content\":\"Q1\\n---\\nA1\"},{\"id\":\"c2\",\"content\":\"Q2\\n---\\nA2\"}],\"bookmark\":\"b1\"}");
            enqueue(200, "{\"docs\":[{\"id\":\"c3\",\"content\":\"Q3\\n---\\nA3\"}],\"bookmark\":\"b2\"}");
            enqueue(200, "{\"docs\":[],\"bookmark\":\"b3\"}");

            List<RemoteCard> cards = client().listCards("AbCd1234");

            assertEquals(List.of("c1", "c2", "c3"), cards.stream().map(RemoteCard::id).toList());
            assertEquals(3, requests.size());
            assertEquals("/api/cards/?deck-id=AbCd1234&limit=2", requests.get(0).uri());
            assertEquals("/api/cards/?deck-id=AbCd1234&limit=2&bookmark=b1", requests.get(1).uri());
            assertEquals("/api/cards/?deck-id=AbCd1234&limit=2&bookmark=b2", requests.get(2).uri());
        }

        @Test
        @DisplayName("Should stop when no bookmark is returned")
        void testNoBookmark() {
            enqueue(200, "{\"docs\":[{\"id\":\"c1\",\"content\":\"Q\\n---\\nA\",\"tags\":[\"t\"],\"archived?\":true}]}");

            List<RemoteCard> cards = client().listCards("AbCd1234");

            assertEquals(1, cards.size());
            assertEquals(List.of("t"), cards.get(0).tags());
            assertTrue(cards.get(0).isArchived());
            assertEquals(1, requests.size());
        }

        @Test
        @DisplayName("Should stop when the server repeats a bookmark")
        void testRepeatedBookmark() {
            enqueue(200, "{\"docs\":[{\"id\":\"c1\",\"content\":\"Q\\n---\\nA\"}],\"bookmark\":\"same\"}");
            enqueue(200, "{\"docs\":[{\"id\":\"c2\",\"content\":\"Q\\n---\\nA\"}],\"bookmark\":\"same\"}");

            List<RemoteCard> cards = client().listCards("AbCd1234");

            assertEquals(2, cards.size());
            assertEquals(2, requests.size());
        }
    }

    @Nested
    @DisplayName("Card mutations")
    class MutationTests {

        @Test
        @DisplayName("Should send only informative optional fields")
        void testCreateCard() throws Exception {
            enqueue(200, "{\"id\":\"new1\",\"content\":\"Q\\n---\\nA\"}");

            RemoteCard card = client().createCard("AbCd1234", "Q\n---\nA", new CardOptions(List.of("python"), false));

            assertEquals("new1", card.id());
            JsonNode body = mapper.readTree(requests.get(0).body());
            assertEquals("Q\n---\nA", body.get("content").asText());
            assertEquals("AbCd1234", body.get("deck-id").asText());
            assertEquals("python", body.get("tags").get(0).asText());
            assertFalse(body.has("archived?"));
        }

        @Test
        @DisplayName("Should post updates to the card path")
        void testUpdateCard() throws Exception {
            enqueue(200, "{\"id\":\"c1\",\"content\":\"Q2\\n---\\nA2\"}");

            client().updateCard("c1", "Q2\n---\nA2", new CardOptions(List.of(), true));

            Recorded request = requests.get(0);
            assertEquals("POST", request.method());
            assertEquals("/api/cards/c1", request.uri());
            JsonNode body = mapper.readTree(request.body());
            assertTrue(body.get("archived?").asBoolean());
            assertFalse(body.has("tags"));
            assertFalse(body.has("deck-id"));
        }

        @Test
        @DisplayName("Should delete cards with an empty response")
        void testDeleteCard() {
            enqueue(204, "");

            assertTrue(client().deleteCard("c1"));
            assertEquals("DELETE", requests.get(0).method());
        }
    }

    @Nested
    @DisplayName("Errors")
    class ErrorTests {

        @Test
        @DisplayName("Should raise a RemoteException carrying status and body")
        void testErrorStatus() {
            enqueue(401, "{\"error\":\"unauthorized\"}");

            RemoteException e = assertThrows(RemoteException.class, () -> client().listDecks());

            assertEquals(401, e.getStatus());
            assertTrue(e.getBody().contains("unauthorized"));
            assertFalse(e.isTransportFailure());
        }

        @Test
        @DisplayName("Should raise a RemoteException for an unparseable body")
        void testBadBody() {
            enqueue(200, "<html>");

            assertThrows(RemoteException.class, () -> client().getDeck("AbCd1234"));
        }

        @Test
        @DisplayName("Should report transport failures without a status")
        void testTransportFailure() {
            HttpRemoteClient client = client();
            server.stop(0);

            RemoteException e = assertThrows(RemoteException.class, client::listDecks);

            assertTrue(e.isTransportFailure());
        }
    }

    @Test
    @DisplayName("Should split remote content at the first delimiter")
    void testRemoteCards() {
        var card = RemoteCards.toCard(new RemoteCard("c1", "Q\n---\nA with --- inside", "d", List.of("t"), null));

        assertEquals("Q", card.question());
        assertEquals("A with --- inside", card.answer());
        assertFalse(card.archived());
        assertArrayEquals(new String[]{"only question", ""}, RemoteCards.splitContent("only question"));
    }
}

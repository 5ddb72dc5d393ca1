package com.deck.mirror.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link RemoteClient} over HTTPS with JSON bodies and HTTP basic authentication
 * (API key as user name, empty password).
 *
 * <p>Usage:</p>
 * <pre>
 * RemoteClient client = HttpRemoteClient.builder()
 *     .apiKey(config.getRemoteApiKey())
 *     .timeout(Duration.ofSeconds(30))
 *     .build();
 * </pre>
 */
public class HttpRemoteClient implements RemoteClient {
    private static final Logger log = LoggerFactory.getLogger(HttpRemoteClient.class);

    private static final String DEFAULT_BASE_URL = "https://app.mochi.cards/api";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    private static final int DEFAULT_PAGE_SIZE = 100;

    private final String baseUrl;
    private final String authorization;
    private final Duration timeout;
    private final int pageSize;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private HttpRemoteClient(Builder builder) {
        String url = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        String apiKey = Objects.requireNonNull(builder.apiKey, "apiKey is required");
        this.authorization = "Basic " + Base64.getEncoder()
                .encodeToString((apiKey + ":").getBytes(StandardCharsets.UTF_8));
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.pageSize = builder.pageSize > 0 ? builder.pageSize : DEFAULT_PAGE_SIZE;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public List<RemoteDeck> listDecks() {
        DeckPage page = send(get("/decks/"), DeckPage.class);
        return page.docs() != null ? page.docs() : List.of();
    }

    @Override
    public RemoteDeck getDeck(String deckId) {
        return send(get("/decks/" + encode(deckId)), RemoteDeck.class);
    }

    @Override
    public RemoteDeck createDeck(String name) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        RemoteDeck deck = send(post("/decks/", body), RemoteDeck.class);
        log.info("remote.deck_created deckId={} name='{}'", deck.id(), name);
        return deck;
    }

    @Override
    public List<RemoteCard> listCards(String deckId) {
        List<RemoteCard> cards = new ArrayList<>();
        String bookmark = null;
        int pages = 0;

        while (true) {
            String path = "/cards/?deck-id=" + encode(deckId) + "&limit=" + pageSize;
            if (bookmark != null) {
                path += "&bookmark=" + encode(bookmark);
            }
            CardPage page = send(get(path), CardPage.class);
            pages++;

            List<RemoteCard> docs = page.docs() != null ? page.docs() : List.of();
            if (docs.isEmpty()) {
                break;
            }
            cards.addAll(docs);

            String next = page.bookmark();
            if (next == null || next.isEmpty()) {
                break;
            }
            if (next.equals(bookmark)) {
                log.warn("remote.bookmark_repeated deckId={} bookmark={} - stopping pagination", deckId, next);
                break;
            }
            bookmark = next;
        }

        log.debug("remote.cards_listed deckId={} cards={} pages={}", deckId, cards.size(), pages);
        return cards;
    }

    @Override
    public RemoteCard createCard(String deckId, String content, CardOptions options) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("content", content);
        body.put("deck-id", deckId);
        (options != null ? options : CardOptions.none()).applyTo(body);
        return send(post("/cards/", body), RemoteCard.class);
    }

    @Override
    public RemoteCard updateCard(String cardId, String content, CardOptions options) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("content", content);
        (options != null ? options : CardOptions.none()).applyTo(body);
        return send(post("/cards/" + encode(cardId), body), RemoteCard.class);
    }

    @Override
    public boolean deleteCard(String cardId) {
        HttpRequest request = request("/cards/" + encode(cardId)).DELETE().build();
        execute(request);
        return true;
    }

    private HttpRequest get(String path) {
        return request(path).GET().build();
    }

    private HttpRequest post(String path, Map<String, Object> body) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode request body for " + path, e);
        }
        return request(path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Accept", "application/json")
                .header("Authorization", authorization);
    }

    private <T> T send(HttpRequest request, Class<T> type) {
        String body = execute(request);
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new RemoteException(200, body,
                    "Unexpected response from " + request.method() + " " + request.uri().getPath() + ": " + e.getOriginalMessage());
        }
    }

    private String execute(HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RemoteException(request.method() + " " + request.uri().getPath() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteException(request.method() + " " + request.uri().getPath() + " interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            log.debug("remote.error method={} path={} status={}", request.method(), request.uri().getPath(), status);
            throw new RemoteException(status, response.body(),
                    request.method() + " " + request.uri().getPath() + " returned status " + status + ": " + response.body());
        }
        return response.body();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String apiKey;
        private Duration timeout;
        private int pageSize;

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

        public HttpRemoteClient build() {
            return new HttpRemoteClient(this);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record DeckPage(List<RemoteDeck> docs, String bookmark) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record CardPage(List<RemoteCard> docs, String bookmark) {}
}

package com.deck.mirror.llm;

import com.deck.mirror.metrics.MetricsService;
import com.deck.mirror.metrics.NoOpMetricsService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * LLM provider for OpenAI-compatible APIs ({@code /chat/completions} and {@code /embeddings}),
 * by default OpenRouter.
 *
 * <p>Response shapes are normalized here: embeddings may arrive as a bare array or
 * wrapped in {@code {"data": [...]}}, and message content as a string or as a list of
 * text parts. Anything else is an {@link LLMException}.</p>
 *
 * <pre>
 * LLMProvider provider = OpenAiCompatibleProvider.builder()
 *     .apiKey(config.getLlmApiKey())
 *     .build();
 * </pre>
 */
public class OpenAiCompatibleProvider implements LLMProvider {
    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleProvider.class);

    private static final String DEFAULT_BASE_URL = "https://openrouter.ai/api/v1";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final MetricsService metricsService;

    private OpenAiCompatibleProvider(Builder builder) {
        String url = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.apiKey = Objects.requireNonNull(builder.apiKey, "apiKey is required");
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
    }

    @Override
    public String complete(CompletionRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", request.model());
        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "user").put("content", request.prompt());
        body.put("temperature", request.temperature());
        body.put("max_tokens", request.maxTokens());

        long start = System.nanoTime();
        boolean success = false;
        try {
            JsonNode response = post("/chat/completions", body);
            String content = extractContent(response);
            success = true;
            return content;
        } finally {
            metricsService.recordLlmCall("complete", success, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    @Override
    public List<float[]> embed(String model, List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        ArrayNode input = body.putArray("input");
        texts.forEach(input::add);

        long start = System.nanoTime();
        boolean success = false;
        try {
            JsonNode response = post("/embeddings", body);
            List<float[]> vectors = extractEmbeddings(response);
            if (vectors.size() != texts.size()) {
                throw new LLMException("Expected " + texts.size() + " embeddings, got " + vectors.size());
            }
            success = true;
            log.debug("llm.embedded model={} texts={}", model, texts.size());
            return vectors;
        } finally {
            metricsService.recordLlmCall("embed", success, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    @Override
    public String getProviderName() {
        return "OpenAI-compatible/" + baseUrl;
    }

    @Override
    public boolean isAvailable() {
        return !apiKey.isBlank();
    }

    private JsonNode post(String path, JsonNode body) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new LLMException("Cannot encode request for " + path, e);
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new LLMException("POST " + path + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LLMException("POST " + path + " interrupted", e);
        }

        if (response.statusCode() != 200) {
            throw new LLMException("POST " + path + " returned status " + response.statusCode() + ": " + response.body());
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new LLMException("Invalid JSON from " + path + ": " + e.getOriginalMessage(), e);
        }
    }

    static String extractContent(JsonNode response) {
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        if (content.isTextual()) {
            return content.asText();
        }
        if (content.isArray()) {
            StringBuilder text = new StringBuilder();
            for (JsonNode part : content) {
                if (part.isTextual()) {
                    text.append(part.asText());
                } else if (part.path("text").isTextual()) {
                    text.append(part.path("text").asText());
                }
            }
            return text.toString();
        }
        throw new LLMException("Unexpected chat completion shape: no message content");
    }

    static List<float[]> extractEmbeddings(JsonNode response) {
        JsonNode items;
        if (response.isArray()) {
            items = response;
        } else if (response.path("data").isArray()) {
            items = response.path("data");
        } else {
            throw new LLMException("Unexpected embeddings shape: expected an array or a data array");
        }

        List<IndexedVector> indexed = new ArrayList<>(items.size());
        int position = 0;
        for (JsonNode item : items) {
            JsonNode embedding = item.isArray() ? item : item.path("embedding");
            if (!embedding.isArray()) {
                throw new LLMException("Unexpected embeddings shape: item " + position + " has no embedding");
            }
            float[] vector = new float[embedding.size()];
            for (int i = 0; i < vector.length; i++) {
                vector[i] = (float) embedding.get(i).asDouble();
            }
            int index = item.path("index").isInt() ? item.path("index").asInt() : position;
            indexed.add(new IndexedVector(index, vector));
            position++;
        }
        indexed.sort(Comparator.comparingInt(IndexedVector::index));

        List<float[]> vectors = new ArrayList<>(indexed.size());
        for (IndexedVector entry : indexed) {
            vectors.add(entry.vector());
        }
        return vectors;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String apiKey;
        private Duration timeout;
        private MetricsService metricsService;

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

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public OpenAiCompatibleProvider build() {
            return new OpenAiCompatibleProvider(this);
        }
    }

    private record IndexedVector(int index, float[] vector) {}
}

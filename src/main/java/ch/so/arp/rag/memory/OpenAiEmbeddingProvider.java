package ch.so.arp.rag.memory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * {@link EmbeddingProvider} calling the {@code /embeddings} endpoint of an
 * OpenAI compatible API. Timeouts, rate limiting and server errors are reported
 * as transient failures, every other non-2xx answer as fatal.
 */
class OpenAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiEmbeddingProvider.class);

    private final OpenAiClientProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    OpenAiEmbeddingProvider(OpenAiClientProperties properties, ObjectMapper objectMapper) {
        this(properties, objectMapper, HttpClient.newBuilder().connectTimeout(properties.getTimeout()).build());
    }

    OpenAiEmbeddingProvider(OpenAiClientProperties properties, ObjectMapper objectMapper, HttpClient httpClient) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new IllegalArgumentException(
                    "Property 'memory.store.openai.api-key' must be provided when mocks are disabled");
        }
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        LOGGER.debug("Requesting {} embeddings with model {} via {}", texts.size(), properties.getModel(),
                properties.getBaseUrl());
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(trimTrailingSlash(properties.getBaseUrl()) + "/embeddings"))
                .timeout(properties.getTimeout())
                .header("Authorization", "Bearer " + properties.getApiKey())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody(texts), StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new EmbeddingProviderException("Embeddings request failed: " + ex.getMessage(), ex, true);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new EmbeddingProviderException("Embeddings request interrupted", ex, false);
        }

        int status = response.statusCode();
        if (status >= 300) {
            throw new EmbeddingProviderException("Embeddings HTTP " + status + ": " + response.body(),
                    isTransientStatus(status));
        }
        return parseResponse(response.body(), texts.size());
    }

    @Override
    public String modelName() {
        return properties.getModel();
    }

    String requestBody(List<String> texts) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", properties.getModel());
        ArrayNode input = body.putArray("input");
        texts.forEach(input::add);
        body.put("encoding_format", "float");
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException ex) {
            throw new EmbeddingProviderException("Unable to serialise embeddings request", ex, false);
        }
    }

    List<float[]> parseResponse(String json, int expected) {
        JsonNode data;
        try {
            data = objectMapper.readTree(json).path("data");
        } catch (JsonProcessingException ex) {
            throw new EmbeddingProviderException("Malformed embeddings response", ex, false);
        }
        if (!data.isArray() || data.size() != expected) {
            throw new EmbeddingProviderException(
                    "Expected " + expected + " embeddings but received " + (data.isArray() ? data.size() : 0), false);
        }
        float[][] ordered = new float[expected][];
        for (int i = 0; i < data.size(); i++) {
            JsonNode item = data.get(i);
            int index = item.path("index").asInt(i);
            if (index < 0 || index >= expected) {
                throw new EmbeddingProviderException("Embedding index out of range: " + index, false);
            }
            JsonNode values = item.path("embedding");
            float[] vector = new float[values.size()];
            for (int j = 0; j < vector.length; j++) {
                vector[j] = (float) values.get(j).asDouble();
            }
            ordered[index] = vector;
        }
        List<float[]> vectors = new ArrayList<>(expected);
        for (float[] vector : ordered) {
            if (vector == null) {
                throw new EmbeddingProviderException("Embeddings response is missing entries", false);
            }
            vectors.add(vector);
        }
        return vectors;
    }

    static boolean isTransientStatus(int status) {
        return status == 408 || status == 429 || status >= 500;
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}

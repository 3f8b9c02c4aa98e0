package ch.so.arp.rag.router.embedding;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.rag.router.OpenAiClientProperties;

/**
 * Embedding provider calling an OpenAI compatible {@code /embeddings}
 * endpoint.
 */
public class OpenAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiEmbeddingProvider.class);

    private final OpenAiClientProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public OpenAiEmbeddingProvider(OpenAiClientProperties properties, Duration requestTimeout) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new IllegalArgumentException(
                    "Property 'rag.router.openai.api-key' must be provided when mocked embeddings are disabled");
        }
        this.properties = properties;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.length() > HashingEmbeddingProvider.MAX_TEXT_LENGTH) {
            throw new EmbeddingException("Text is missing or exceeds " + HashingEmbeddingProvider.MAX_TEXT_LENGTH
                    + " characters");
        }
        String body;
        try {
            body = objectMapper.writeValueAsString(Map.of("model", properties.getEmbeddingModel(), "input", text));
        } catch (JsonProcessingException ex) {
            throw new EmbeddingException("Unable to serialize embedding request", ex);
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(properties.getBaseUrl().replaceAll("/+$", "") + "/embeddings"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + properties.getApiKey())
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new EmbeddingException("Embedding endpoint answered with status " + response.statusCode());
            }
            return toVector(objectMapper.readTree(response.body()).path("data").path(0).path("embedding"));
        } catch (IOException ex) {
            throw new EmbeddingException("Embedding request failed: " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Embedding request interrupted", ex);
        }
    }

    private float[] toVector(JsonNode node) {
        if (!node.isArray() || node.isEmpty()) {
            throw new EmbeddingException("Embedding response did not contain a vector");
        }
        float[] vector = new float[node.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) node.get(i).asDouble();
        }
        LOGGER.debug("Received embedding with {} dimensions from model {}", vector.length,
                properties.getEmbeddingModel());
        return vector;
    }
}

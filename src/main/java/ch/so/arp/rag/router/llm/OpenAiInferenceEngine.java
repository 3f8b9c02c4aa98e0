package ch.so.arp.rag.router.llm;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.rag.router.OpenAiClientProperties;

/**
 * {@link InferenceEngine} talking to an OpenAI compatible
 * {@code /chat/completions} endpoint. Ollama exposes the same API under
 * {@code /v1}, so a local model works by changing the base URL.
 */
public class OpenAiInferenceEngine implements InferenceEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiInferenceEngine.class);

    private static final String SYSTEM_PROMPT = "You are a helpful assistant. Answer using only the information given to you.";

    private final OpenAiClientProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public OpenAiInferenceEngine(OpenAiClientProperties properties, Duration requestTimeout) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new IllegalArgumentException(
                    "Property 'rag.router.openai.api-key' must be provided when mocks are disabled");
        }
        this.properties = properties;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String generate(String prompt, GenerationOptions options) {
        LOGGER.debug("Requesting completion from model {} via base URL {} (api key {})", properties.getModel(),
                properties.getBaseUrl(), mask(properties.getApiKey()));
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(stripTrailingSlash(properties.getBaseUrl()) + "/chat/completions"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + properties.getApiKey())
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(buildRequest(prompt, options)))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException ex) {
            throw InferenceException.engineUnavailable("Inference endpoint unreachable: " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw InferenceException.engineUnavailable("Inference request interrupted", ex);
        }

        if (response.statusCode() / 100 != 2) {
            LOGGER.warn("Inference endpoint answered with status {}", response.statusCode());
            throw InferenceException.engineUnavailable(
                    "Inference endpoint answered with status " + response.statusCode(), null);
        }
        return extractContent(response.body());
    }

    @Override
    public String modelId() {
        return properties.getModel();
    }

    String buildRequest(String prompt, GenerationOptions options) {
        Map<String, Object> body = Map.of(
                "model", properties.getModel(),
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", prompt)),
                "temperature", options.temperature(),
                "max_tokens", options.maxTokens(),
                "stream", false);
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize completion request", ex);
        }
    }

    String extractContent(String body) {
        JsonNode content;
        try {
            content = objectMapper.readTree(body).path("choices").path(0).path("message").path("content");
        } catch (JsonProcessingException ex) {
            throw InferenceException.engineUnavailable("Unreadable completion payload", ex);
        }
        String text = content.isTextual() ? content.asText() : "";
        if (text.isBlank()) {
            throw InferenceException.emptyCompletion("Model " + properties.getModel() + " returned no content");
        }
        return text.trim();
    }

    private String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private String mask(String apiKey) {
        if (apiKey == null || apiKey.length() < 4) {
            return "***";
        }
        return "***" + apiKey.substring(apiKey.length() - 4);
    }
}

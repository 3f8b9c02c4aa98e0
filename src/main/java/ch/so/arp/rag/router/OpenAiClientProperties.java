package ch.so.arp.rag.router;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for an OpenAI compatible inference endpoint. Pointing
 * the base URL at {@code http://localhost:11434/v1} talks to a local Ollama.
 */
@ConfigurationProperties(prefix = "rag.router.openai")
public class OpenAiClientProperties {

    /**
     * API key that authorises requests against the endpoint.
     */
    private String apiKey;

    /**
     * Base URL for the API. Defaults to the public OpenAI endpoint.
     */
    private String baseUrl = "https://api.openai.com/v1";

    /**
     * Name of the chat model that should be used.
     */
    private String model = "gpt-4o-mini";

    /**
     * Name of the embedding model used when mocked embeddings are disabled.
     */
    private String embeddingModel = "text-embedding-3-small";

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getEmbeddingModel() {
        return embeddingModel;
    }

    public void setEmbeddingModel(String embeddingModel) {
        this.embeddingModel = embeddingModel;
    }
}

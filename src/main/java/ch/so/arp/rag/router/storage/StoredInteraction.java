package ch.so.arp.rag.router.storage;

import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import ch.so.arp.rag.router.Query;
import ch.so.arp.rag.router.classify.Classification;
import ch.so.arp.rag.router.retrieval.Provenance;

/**
 * A finished interaction as it is written back to the vector store so that
 * later queries can retrieve it as a prior response.
 */
public record StoredInteraction(String response, float[] embedding, Map<String, Object> metadata) {

    static final String SOURCE = "ai_response";

    public StoredInteraction {
        Objects.requireNonNull(response, "response");
        embedding = Objects.requireNonNull(embedding, "embedding").clone();
        metadata = Map.copyOf(metadata);
    }

    @Override
    public float[] embedding() {
        return embedding.clone();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof StoredInteraction that && response.equals(that.response)
                && Arrays.equals(embedding, that.embedding) && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(response, Arrays.hashCode(embedding), metadata);
    }

    @Override
    public String toString() {
        return "StoredInteraction[response=" + response + ", dimensions=" + embedding.length + ", metadata="
                + metadata + "]";
    }

    public static Map<String, Object> metadataFor(Query query, Classification classification, String modelId) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("query", query.text());
        metadata.put("classification", classification.tag());
        metadata.put("timestamp", query.receivedAt().toString());
        metadata.put("model", modelId == null ? "unknown" : modelId);
        metadata.put("type", Provenance.PROCESSED_RESPONSE_TYPE);
        metadata.put("source", SOURCE);
        return metadata;
    }

    public Instant timestamp() {
        return Instant.parse((String) metadata.get("timestamp"));
    }
}

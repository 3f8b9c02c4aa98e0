package ch.so.arp.rag.router.vector;

import java.util.Map;

/**
 * Result element returned by a similarity search. The score is the cosine
 * similarity between the query embedding and the stored embedding.
 */
public record VectorMatch(String id, String text, Map<String, Object> metadata, double score) {

    public VectorMatch {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public String metadataValue(String key) {
        Object value = metadata.get(key);
        return value == null ? "" : String.valueOf(value);
    }
}

package ch.so.arp.rag.router.embedding;

/**
 * Strategy abstraction used to compute embeddings for queries and responses.
 * Implementations can either call a remote embedding API or provide
 * deterministic vectors that are suited for tests and local development.
 */
@FunctionalInterface
public interface EmbeddingProvider {

    /**
     * Create an embedding vector for the provided text.
     *
     * @param text the text to embed
     * @return the embedding represented as a float array
     * @throws EmbeddingException if the text is malformed or too large, or the
     *                            provider fails
     */
    float[] embed(String text);
}

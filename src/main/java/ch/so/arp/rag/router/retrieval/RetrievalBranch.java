package ch.so.arp.rag.router.retrieval;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.router.embedding.EmbeddingProvider;
import ch.so.arp.rag.router.support.TimeLimitedExecutor;
import ch.so.arp.rag.router.vector.VectorMatch;
import ch.so.arp.rag.router.vector.VectorStore;

/**
 * Embeds the query, searches the vector store and turns the nearest neighbours
 * into {@link ContextItem}s. Read-only against the store.
 */
public class RetrievalBranch {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetrievalBranch.class);

    static final int MAX_TOP_K = 20;

    private final EmbeddingProvider embeddingProvider;
    private final VectorStore vectorStore;
    private final TimeLimitedExecutor timeLimitedExecutor;
    private final Duration timeout;
    private final double minScore;

    public RetrievalBranch(EmbeddingProvider embeddingProvider, VectorStore vectorStore,
            TimeLimitedExecutor timeLimitedExecutor, Duration timeout, double minScore) {
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        this.vectorStore = Objects.requireNonNull(vectorStore, "vectorStore");
        this.timeLimitedExecutor = Objects.requireNonNull(timeLimitedExecutor, "timeLimitedExecutor");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.minScore = minScore;
    }

    /**
     * Retrieve context for the query. The returned stream is lazy and can be
     * consumed once; it holds at most {@code topK} items in non-increasing
     * relevance order and is empty when nothing clears the minimum score.
     *
     * @throws ch.so.arp.rag.router.vector.StorageException          if the store fails
     * @throws ch.so.arp.rag.router.embedding.EmbeddingException     if the query cannot be embedded
     * @throws ch.so.arp.rag.router.support.StageTimeoutException    if either call runs too long
     */
    public Stream<ContextItem> retrieve(String query, int topK) {
        if (query == null || query.isBlank() || topK <= 0) {
            return Stream.empty();
        }
        int limit = Math.min(topK, MAX_TOP_K);
        List<VectorMatch> matches = timeLimitedExecutor.call("retrieval", timeout, () -> {
            float[] embedding = embeddingProvider.embed(query);
            return vectorStore.search(embedding, limit);
        });
        LOGGER.debug("Vector store returned {} candidates for '{}'", matches.size(), query);
        return matches.stream()
                .map(this::toContextItem)
                .filter(item -> item.relevance() >= minScore)
                .sorted(Comparator.comparingDouble(ContextItem::relevance).reversed())
                .limit(limit);
    }

    private ContextItem toContextItem(VectorMatch match) {
        String source = match.metadataValue("source");
        double relevance = Math.max(0.0d, Math.min(1.0d, match.score()));
        return new ContextItem(match.text(), source.isBlank() ? match.id() : source, relevance,
                Provenance.fromMetadata(match.metadata()));
    }
}

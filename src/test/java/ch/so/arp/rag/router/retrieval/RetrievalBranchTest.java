package ch.so.arp.rag.router.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import ch.so.arp.rag.router.embedding.HashingEmbeddingProvider;
import ch.so.arp.rag.router.support.StageTimeoutException;
import ch.so.arp.rag.router.support.TimeLimitedExecutor;
import ch.so.arp.rag.router.vector.InMemoryVectorStore;
import ch.so.arp.rag.router.vector.StorageException;
import ch.so.arp.rag.router.vector.VectorMatch;
import ch.so.arp.rag.router.vector.VectorStore;

class RetrievalBranchTest {

    private final ExecutorService executorService = Executors.newCachedThreadPool();
    private final TimeLimitedExecutor timeLimitedExecutor = new TimeLimitedExecutor(executorService);
    private final HashingEmbeddingProvider embeddingProvider = new HashingEmbeddingProvider(1024);

    @AfterEach
    void shutdown() {
        executorService.shutdownNow();
    }

    @Test
    void ordersByRelevanceAndTagsProvenance() {
        SearchOnlyStore store = (embedding, topK) -> List.of(
                new VectorMatch("1", "doc text", Map.of("source", "plan.pdf"), 0.4d),
                new VectorMatch("2", "earlier answer", Map.of("type", Provenance.PROCESSED_RESPONSE_TYPE), 0.9d),
                new VectorMatch("3", "weak", Map.of(), 0.1d));

        List<ContextItem> items = branch(store, 0.2d).retrieve("zoning plan", 4).toList();

        assertThat(items).containsExactly(
                new ContextItem("earlier answer", "2", 0.9d, Provenance.PRIOR_RESPONSE),
                new ContextItem("doc text", "plan.pdf", 0.4d, Provenance.DOCUMENT));
    }

    @Test
    void tiesKeepStoreOrder() {
        SearchOnlyStore store = (embedding, topK) -> List.of(
                new VectorMatch("1", "first", Map.of(), 0.5d),
                new VectorMatch("2", "second", Map.of(), 0.5d));

        assertThat(branch(store, 0.0d).retrieve("query", 4).map(ContextItem::text))
                .containsExactly("first", "second");
    }

    @Test
    void emptyStoreAndBlankQueryYieldEmptyStream() {
        AtomicInteger searches = new AtomicInteger();
        SearchOnlyStore store = (embedding, topK) -> {
            searches.incrementAndGet();
            return List.of();
        };
        RetrievalBranch branch = branch(store, 0.2d);

        assertThat(branch.retrieve("Summarize the uploaded report", 4)).isEmpty();
        assertThat(branch.retrieve("  ", 4)).isEmpty();
        assertThat(branch.retrieve("query", 0)).isEmpty();
        assertThat(searches).hasValue(1);
    }

    @Test
    void capsTopK() {
        AtomicInteger requested = new AtomicInteger();
        SearchOnlyStore store = (embedding, topK) -> {
            requested.set(topK);
            return List.of();
        };

        branch(store, 0.2d).retrieve("query", 500).toList();

        assertThat(requested).hasValue(RetrievalBranch.MAX_TOP_K);
    }

    @Test
    void findsStoredDocumentsByVocabulary() {
        InMemoryVectorStore store = new InMemoryVectorStore();
        store.upsert("Photosynthesis explained", embeddingProvider.embed("Photosynthesis explained"),
                Map.of("source", "biology.pdf"));
        store.upsert("Cantonal road network", embeddingProvider.embed("Cantonal road network"),
                Map.of("source", "roads.pdf"));

        List<ContextItem> items = branch(store, 0.2d).retrieve("What is photosynthesis?", 4).toList();

        assertThat(items).extracting(ContextItem::sourceId).containsExactly("biology.pdf");
    }

    @Test
    void propagatesStoreFailures() {
        SearchOnlyStore store = (embedding, topK) -> {
            throw new StorageException("connection refused");
        };

        assertThatThrownBy(() -> branch(store, 0.2d).retrieve("query", 4))
                .isInstanceOf(StorageException.class);
    }

    @Test
    void slowStoreTimesOut() {
        SearchOnlyStore store = (embedding, topK) -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return List.of();
        };
        RetrievalBranch branch = new RetrievalBranch(embeddingProvider, store, timeLimitedExecutor,
                Duration.ofMillis(50), 0.2d);

        assertThatThrownBy(() -> branch.retrieve("query", 4))
                .isInstanceOf(StageTimeoutException.class);
    }

    private RetrievalBranch branch(VectorStore store, double minScore) {
        return new RetrievalBranch(embeddingProvider, store, timeLimitedExecutor, Duration.ofSeconds(5), minScore);
    }

    @FunctionalInterface
    interface SearchOnlyStore extends VectorStore {

        @Override
        default void upsert(String text, float[] embedding, Map<String, Object> metadata) {
            throw new UnsupportedOperationException("read only");
        }
    }
}

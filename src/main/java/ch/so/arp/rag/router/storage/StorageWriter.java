package ch.so.arp.rag.router.storage;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.router.Query;
import ch.so.arp.rag.router.classify.Classification;
import ch.so.arp.rag.router.embedding.EmbeddingProvider;
import ch.so.arp.rag.router.support.TimeLimitedExecutor;
import ch.so.arp.rag.router.vector.StorageException;
import ch.so.arp.rag.router.vector.VectorStore;

/**
 * Writes final answers back to the vector store. {@link #submit} hands the
 * write to the storage executor and returns immediately.
 */
public class StorageWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(StorageWriter.class);

    private final EmbeddingProvider embeddingProvider;
    private final VectorStore vectorStore;
    private final String modelId;
    private final Executor storageExecutor;
    private final TimeLimitedExecutor timeLimitedExecutor;
    private final Duration timeout;

    public StorageWriter(EmbeddingProvider embeddingProvider, VectorStore vectorStore, String modelId,
            Executor storageExecutor, TimeLimitedExecutor timeLimitedExecutor, Duration timeout) {
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        this.vectorStore = Objects.requireNonNull(vectorStore, "vectorStore");
        this.modelId = modelId;
        this.storageExecutor = Objects.requireNonNull(storageExecutor, "storageExecutor");
        this.timeLimitedExecutor = Objects.requireNonNull(timeLimitedExecutor, "timeLimitedExecutor");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    /**
     * Embed and store the response synchronously.
     *
     * @throws StorageException if embedding or writing fails or runs too long
     */
    public StoredInteraction persist(Query query, String response, Classification classification) {
        if (response == null || response.isBlank()) {
            throw new StorageException("Refusing to store an empty response");
        }
        try {
            return timeLimitedExecutor.call("storage", timeout, () -> {
                float[] embedding = embeddingProvider.embed(response);
                StoredInteraction interaction = new StoredInteraction(response, embedding,
                        StoredInteraction.metadataFor(query, classification, modelId));
                vectorStore.upsert(interaction.response(), interaction.embedding(), interaction.metadata());
                return interaction;
            });
        } catch (StorageException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new StorageException("Could not store interaction: " + ex.getMessage(), ex);
        }
    }

    /**
     * Schedule {@link #persist} on the storage executor. The task runs once and
     * logs its outcome.
     *
     * @return {@code false} if the executor rejected the task
     */
    public boolean submit(String requestId, Query query, String response, Classification classification) {
        try {
            storageExecutor.execute(() -> {
                try {
                    persist(query, response, classification);
                    LOGGER.info("[{}] Stored interaction ({} chars, classification {})", requestId,
                            response.length(), classification.tag());
                } catch (StorageException ex) {
                    LOGGER.error("[{}] Storing interaction failed: {}", requestId, ex.getMessage(), ex);
                }
            });
            return true;
        } catch (RejectedExecutionException ex) {
            LOGGER.warn("[{}] Storage executor rejected the interaction: {}", requestId, ex.getMessage());
            return false;
        }
    }
}

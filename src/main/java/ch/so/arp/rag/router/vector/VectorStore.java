package ch.so.arp.rag.router.vector;

import java.util.List;
import java.util.Map;

/**
 * Minimal vector store abstraction. Reads and writes are independent atomic
 * operations; implementations synchronize themselves.
 */
public interface VectorStore {

    /**
     * Find the entries closest to the embedding.
     *
     * @param embedding the query embedding
     * @param topK      the maximum amount of matches to return
     * @return matches ordered by descending similarity, ties in insertion order
     * @throws StorageException if the store cannot be queried
     */
    List<VectorMatch> search(float[] embedding, int topK);

    /**
     * Add a new entry. Entries are never replaced, every call creates a record.
     *
     * @param text      the stored text
     * @param embedding the embedding of the text
     * @param metadata  flat mapping of string keys to scalar values
     * @throws StorageException if the entry cannot be written
     */
    void upsert(String text, float[] embedding, Map<String, Object> metadata);
}

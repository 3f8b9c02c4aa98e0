package ch.so.arp.rag.router.vector;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lightweight replacement for the PostgreSQL based vector store. Entries are
 * kept in insertion order and searched exhaustively, which keeps unit tests
 * and local development independent of a running database.
 */
public class InMemoryVectorStore implements VectorStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryVectorStore.class);

    private final List<Entry> entries = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public List<VectorMatch> search(float[] embedding, int topK) {
        if (topK <= 0) {
            return List.of();
        }
        lock.readLock().lock();
        try {
            // List.sort is stable, equal scores keep insertion order
            List<VectorMatch> matches = new ArrayList<>(entries.size());
            for (Entry entry : entries) {
                if (entry.embedding().length == embedding.length) {
                    matches.add(new VectorMatch(entry.id(), entry.text(), entry.metadata(),
                            cosine(embedding, entry.embedding())));
                }
            }
            matches.sort(Comparator.comparingDouble(VectorMatch::score).reversed());
            return List.copyOf(matches.subList(0, Math.min(topK, matches.size())));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void upsert(String text, float[] embedding, Map<String, Object> metadata) {
        if (text == null || embedding == null || embedding.length == 0) {
            throw new StorageException("Text and a non-empty embedding are required");
        }
        validateMetadata(metadata);
        lock.writeLock().lock();
        try {
            if (!entries.isEmpty() && entries.get(0).embedding().length != embedding.length) {
                throw new StorageException("Embedding has " + embedding.length + " dimensions, store expects "
                        + entries.get(0).embedding().length);
            }
            String id = String.valueOf(entries.size() + 1);
            entries.add(new Entry(id, text, embedding.clone(), Map.copyOf(metadata)));
            LOGGER.debug("Stored entry {} ({} entries in total)", id, entries.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    static void validateMetadata(Map<String, Object> metadata) {
        if (metadata == null) {
            throw new StorageException("Metadata is required");
        }
        metadata.forEach((key, value) -> {
            if (key == null || !(value instanceof String || value instanceof Number || value instanceof Boolean)) {
                throw new StorageException("Metadata entry '" + key + "' is not a scalar value");
            }
        });
    }

    private static double cosine(float[] left, float[] right) {
        double dot = 0.0d;
        double leftNorm = 0.0d;
        double rightNorm = 0.0d;
        for (int i = 0; i < left.length; i++) {
            dot += left[i] * right[i];
            leftNorm += left[i] * left[i];
            rightNorm += right[i] * right[i];
        }
        if (leftNorm == 0.0d || rightNorm == 0.0d) {
            return 0.0d;
        }
        return dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
    }

    private record Entry(String id, String text, float[] embedding, Map<String, Object> metadata) {
    }
}

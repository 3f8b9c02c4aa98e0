package ch.so.arp.rag.router.embedding;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic embedding provider based on feature hashing. Every token is
 * hashed into one signed dimension and the resulting bag of words is L2
 * normalized, so texts sharing vocabulary end up close in cosine space. It
 * allows the application to run without external API calls while keeping
 * similarity search meaningful.
 */
public class HashingEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(HashingEmbeddingProvider.class);

    static final int MAX_TEXT_LENGTH = 32_000;

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "are", "was", "were", "what", "whats", "with", "this", "that", "from",
            "you", "your", "can", "how", "about", "into", "has", "have", "had", "not", "but", "its", "our",
            "tell", "please", "there", "their", "which", "who", "why", "when", "where");

    private final int dimensions;

    public HashingEmbeddingProvider(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
        LOGGER.info("Using hashed embeddings with {} dimensions", dimensions);
    }

    @Override
    public float[] embed(String text) {
        if (text == null) {
            throw new EmbeddingException("Cannot embed null text");
        }
        if (text.length() > MAX_TEXT_LENGTH) {
            throw new EmbeddingException(
                    "Text of " + text.length() + " characters exceeds the limit of " + MAX_TEXT_LENGTH);
        }
        float[] vector = new float[dimensions];
        String normalized = text.toLowerCase(Locale.ROOT).replace("'", "");
        for (String token : normalized.split("\\W+")) {
            if (token.length() < 3 || STOP_WORDS.contains(token)) {
                continue;
            }
            byte[] hash = sha256(token);
            int bucket = Math.floorMod(bytesToInt(hash), dimensions);
            float sign = (hash[4] & 0x01) == 0 ? 1.0f : -1.0f;
            vector[bucket] += sign;
        }
        double norm = 0.0d;
        for (float value : vector) {
            norm += value * value;
        }
        norm = Math.sqrt(norm);
        if (norm > 0) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] = (float) (vector[i] / norm);
            }
        }
        return vector;
    }

    public int getDimensions() {
        return dimensions;
    }

    private byte[] sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm not available", ex);
        }
    }

    private int bytesToInt(byte[] bytes) {
        int result = 0;
        for (int i = 0; i < 4; i++) {
            result = (result << 8) | (bytes[i] & 0xFF);
        }
        return result;
    }
}

package ch.so.arp.rag.router.llm;

/**
 * Sampling options for a single completion.
 */
public record GenerationOptions(double temperature, int maxTokens) {

    public GenerationOptions {
        if (temperature < 0.0d) {
            throw new IllegalArgumentException("temperature must not be negative");
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }
    }

    public static GenerationOptions deterministic(int maxTokens) {
        return new GenerationOptions(0.0d, maxTokens);
    }
}

package ch.so.arp.rag.router;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning knobs of the query routing pipeline.
 */
@ConfigurationProperties(prefix = "rag.router")
public class RouterProperties {

    /**
     * Use the deterministic inference engine instead of a remote one.
     */
    private boolean mockInference = true;

    /**
     * Use hashed embeddings instead of a remote embedding model.
     */
    private boolean mockEmbeddings = true;

    /**
     * Keep the vector store in memory instead of PostgreSQL.
     */
    private boolean mockVectorStore = true;

    /**
     * Serve canned weather observations instead of calling OpenWeatherMap.
     */
    private boolean mockLiveData = true;

    private final Classifier classifier = new Classifier();

    private final Retrieval retrieval = new Retrieval();

    private final Synthesis synthesis = new Synthesis();

    private final Enhancement enhancement = new Enhancement();

    private final Storage storage = new Storage();

    private final Evaluation evaluation = new Evaluation();

    private final Timeouts timeouts = new Timeouts();

    private final Embedding embedding = new Embedding();

    public boolean isMockInference() {
        return mockInference;
    }

    public void setMockInference(boolean mockInference) {
        this.mockInference = mockInference;
    }

    public boolean isMockEmbeddings() {
        return mockEmbeddings;
    }

    public void setMockEmbeddings(boolean mockEmbeddings) {
        this.mockEmbeddings = mockEmbeddings;
    }

    public boolean isMockVectorStore() {
        return mockVectorStore;
    }

    public void setMockVectorStore(boolean mockVectorStore) {
        this.mockVectorStore = mockVectorStore;
    }

    public boolean isMockLiveData() {
        return mockLiveData;
    }

    public void setMockLiveData(boolean mockLiveData) {
        this.mockLiveData = mockLiveData;
    }

    public Classifier getClassifier() {
        return classifier;
    }

    public Retrieval getRetrieval() {
        return retrieval;
    }

    public Synthesis getSynthesis() {
        return synthesis;
    }

    public Enhancement getEnhancement() {
        return enhancement;
    }

    public Storage getStorage() {
        return storage;
    }

    public Evaluation getEvaluation() {
        return evaluation;
    }

    public Timeouts getTimeouts() {
        return timeouts;
    }

    public Embedding getEmbedding() {
        return embedding;
    }

    public static class Classifier {

        /**
         * Either {@code keyword} or {@code inference}.
         */
        private String mode = "keyword";

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }
    }

    public static class Retrieval {

        /**
         * Number of context items handed to the synthesizer.
         */
        private int topK = 4;

        /**
         * Items scoring below this relevance are not considered evidence.
         */
        private double minScore = 0.2d;

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }

        public double getMinScore() {
            return minScore;
        }

        public void setMinScore(double minScore) {
            this.minScore = minScore;
        }
    }

    public static class Synthesis {

        private int maxEvidenceChars = 6000;

        private double temperature = 0.3d;

        private int maxTokens = 300;

        public int getMaxEvidenceChars() {
            return maxEvidenceChars;
        }

        public void setMaxEvidenceChars(int maxEvidenceChars) {
            this.maxEvidenceChars = maxEvidenceChars;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }
    }

    public static class Enhancement {

        private boolean enabled = true;

        private double temperature = 0.3d;

        private int maxTokens = 400;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }
    }

    public static class Storage {

        /**
         * Write finished interactions back into the vector store.
         */
        private boolean enabled = true;

        /**
         * Also persist the fixed "no information available" answer.
         */
        private boolean storeFallbackAnswers = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isStoreFallbackAnswers() {
            return storeFallbackAnswers;
        }

        public void setStoreFallbackAnswers(boolean storeFallbackAnswers) {
            this.storeFallbackAnswers = storeFallbackAnswers;
        }
    }

    public static class Evaluation {

        /**
         * Score every answer before returning it.
         */
        private boolean inline = true;

        public boolean isInline() {
            return inline;
        }

        public void setInline(boolean inline) {
            this.inline = inline;
        }
    }

    public static class Timeouts {

        private Duration liveData = Duration.ofSeconds(10);

        private Duration inference = Duration.ofSeconds(60);

        private Duration vectorStore = Duration.ofSeconds(10);

        private Duration classification = Duration.ofSeconds(15);

        public Duration getLiveData() {
            return liveData;
        }

        public void setLiveData(Duration liveData) {
            this.liveData = liveData;
        }

        public Duration getInference() {
            return inference;
        }

        public void setInference(Duration inference) {
            this.inference = inference;
        }

        public Duration getVectorStore() {
            return vectorStore;
        }

        public void setVectorStore(Duration vectorStore) {
            this.vectorStore = vectorStore;
        }

        public Duration getClassification() {
            return classification;
        }

        public void setClassification(Duration classification) {
            this.classification = classification;
        }
    }

    public static class Embedding {

        /**
         * Vector size of the hashed embeddings.
         */
        private int dimensions = 1024;

        public int getDimensions() {
            return dimensions;
        }

        public void setDimensions(int dimensions) {
            this.dimensions = dimensions;
        }
    }
}

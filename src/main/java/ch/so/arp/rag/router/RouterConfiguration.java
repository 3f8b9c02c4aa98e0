package ch.so.arp.rag.router;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.rag.router.answer.Enhancer;
import ch.so.arp.rag.router.answer.Synthesizer;
import ch.so.arp.rag.router.classify.InferenceQueryClassifier;
import ch.so.arp.rag.router.classify.KeywordQueryClassifier;
import ch.so.arp.rag.router.classify.QueryClassifier;
import ch.so.arp.rag.router.embedding.EmbeddingProvider;
import ch.so.arp.rag.router.embedding.HashingEmbeddingProvider;
import ch.so.arp.rag.router.embedding.OpenAiEmbeddingProvider;
import ch.so.arp.rag.router.evaluation.ResponseEvaluator;
import ch.so.arp.rag.router.livedata.LiveDataBranch;
import ch.so.arp.rag.router.livedata.LiveDataProvider;
import ch.so.arp.rag.router.livedata.LocationExtractor;
import ch.so.arp.rag.router.livedata.MockLiveDataProvider;
import ch.so.arp.rag.router.livedata.OpenWeatherMapProvider;
import ch.so.arp.rag.router.llm.GenerationOptions;
import ch.so.arp.rag.router.llm.InferenceEngine;
import ch.so.arp.rag.router.llm.MockInferenceEngine;
import ch.so.arp.rag.router.llm.OpenAiInferenceEngine;
import ch.so.arp.rag.router.retrieval.RetrievalBranch;
import ch.so.arp.rag.router.storage.StorageWriter;
import ch.so.arp.rag.router.support.TimeLimitedExecutor;
import ch.so.arp.rag.router.vector.InMemoryVectorStore;
import ch.so.arp.rag.router.vector.PostgresVectorStore;
import ch.so.arp.rag.router.vector.VectorStore;

/**
 * Central configuration wiring the pipeline components together. The
 * {@code rag.router.mock-*} toggles decide whether mocked or real
 * infrastructure is used.
 */
@Configuration
@EnableConfigurationProperties({ RouterProperties.class, OpenAiClientProperties.class,
        OpenWeatherProperties.class })
public class RouterConfiguration {

    @Bean(destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "stageExecutor")
    public ExecutorService stageExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("router-stage-"));
    }

    @Bean
    @ConditionalOnMissingBean(name = "storageExecutor")
    public ThreadPoolTaskExecutor storageExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("router-storage-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    public TimeLimitedExecutor timeLimitedExecutor(@Qualifier("stageExecutor") ExecutorService stageExecutor) {
        return new TimeLimitedExecutor(stageExecutor);
    }

    @Bean
    @ConditionalOnProperty(name = "rag.router.mock-inference", havingValue = "true", matchIfMissing = true)
    public InferenceEngine mockInferenceEngine() {
        return new MockInferenceEngine();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.router.mock-inference", havingValue = "false")
    public InferenceEngine openAiInferenceEngine(OpenAiClientProperties openAiProperties,
            RouterProperties properties) {
        return new OpenAiInferenceEngine(openAiProperties, properties.getTimeouts().getInference());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.router.mock-embeddings", havingValue = "true", matchIfMissing = true)
    public EmbeddingProvider hashingEmbeddingProvider(RouterProperties properties) {
        return new HashingEmbeddingProvider(properties.getEmbedding().getDimensions());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.router.mock-embeddings", havingValue = "false")
    public EmbeddingProvider openAiEmbeddingProvider(OpenAiClientProperties openAiProperties,
            RouterProperties properties) {
        return new OpenAiEmbeddingProvider(openAiProperties, properties.getTimeouts().getVectorStore());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.router.mock-vector-store", havingValue = "true", matchIfMissing = true)
    public VectorStore inMemoryVectorStore() {
        return new InMemoryVectorStore();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.router.mock-vector-store", havingValue = "false")
    public VectorStore postgresVectorStore(JdbcClient jdbcClient, ObjectProvider<ObjectMapper> objectMapper) {
        return new PostgresVectorStore(jdbcClient, objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnProperty(name = "rag.router.mock-live-data", havingValue = "true", matchIfMissing = true)
    public LiveDataProvider mockLiveDataProvider() {
        return new MockLiveDataProvider();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.router.mock-live-data", havingValue = "false")
    public LiveDataProvider openWeatherMapProvider(OpenWeatherProperties openWeatherProperties) {
        return new OpenWeatherMapProvider(openWeatherProperties);
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryClassifier queryClassifier(RouterProperties properties, InferenceEngine inferenceEngine,
            TimeLimitedExecutor timeLimitedExecutor) {
        KeywordQueryClassifier keywordClassifier = new KeywordQueryClassifier();
        String mode = properties.getClassifier().getMode();
        if ("keyword".equalsIgnoreCase(mode)) {
            return keywordClassifier;
        }
        if ("inference".equalsIgnoreCase(mode)) {
            return new InferenceQueryClassifier(inferenceEngine, keywordClassifier, timeLimitedExecutor,
                    properties.getTimeouts().getClassification());
        }
        throw new IllegalArgumentException("Unknown classifier mode '" + mode + "', expected keyword or inference");
    }

    @Bean
    @ConditionalOnMissingBean
    public LocationExtractor locationExtractor() {
        return new LocationExtractor();
    }

    @Bean
    public LiveDataBranch liveDataBranch(LiveDataProvider liveDataProvider, LocationExtractor locationExtractor,
            TimeLimitedExecutor timeLimitedExecutor, RouterProperties properties) {
        return new LiveDataBranch(liveDataProvider, locationExtractor, timeLimitedExecutor,
                properties.getTimeouts().getLiveData());
    }

    @Bean
    public RetrievalBranch retrievalBranch(EmbeddingProvider embeddingProvider, VectorStore vectorStore,
            TimeLimitedExecutor timeLimitedExecutor, RouterProperties properties) {
        return new RetrievalBranch(embeddingProvider, vectorStore, timeLimitedExecutor,
                properties.getTimeouts().getVectorStore(), properties.getRetrieval().getMinScore());
    }

    @Bean
    public Synthesizer synthesizer(InferenceEngine inferenceEngine, TimeLimitedExecutor timeLimitedExecutor,
            RouterProperties properties) {
        RouterProperties.Synthesis synthesis = properties.getSynthesis();
        return new Synthesizer(inferenceEngine, timeLimitedExecutor, properties.getTimeouts().getInference(),
                new GenerationOptions(synthesis.getTemperature(), synthesis.getMaxTokens()),
                synthesis.getMaxEvidenceChars());
    }

    @Bean
    public Enhancer enhancer(InferenceEngine inferenceEngine, TimeLimitedExecutor timeLimitedExecutor,
            RouterProperties properties) {
        RouterProperties.Enhancement enhancement = properties.getEnhancement();
        return new Enhancer(inferenceEngine, timeLimitedExecutor, properties.getTimeouts().getInference(),
                new GenerationOptions(enhancement.getTemperature(), enhancement.getMaxTokens()));
    }

    @Bean
    public StorageWriter storageWriter(EmbeddingProvider embeddingProvider, VectorStore vectorStore,
            InferenceEngine inferenceEngine, @Qualifier("storageExecutor") ThreadPoolTaskExecutor storageExecutor,
            TimeLimitedExecutor timeLimitedExecutor, RouterProperties properties) {
        return new StorageWriter(embeddingProvider, vectorStore, inferenceEngine.modelId(), storageExecutor,
                timeLimitedExecutor, properties.getTimeouts().getVectorStore());
    }

    @Bean
    @ConditionalOnMissingBean
    public ResponseEvaluator responseEvaluator() {
        return new ResponseEvaluator();
    }
}

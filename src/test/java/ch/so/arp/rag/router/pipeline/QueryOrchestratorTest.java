package ch.so.arp.rag.router.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import ch.so.arp.rag.router.RouterProperties;
import ch.so.arp.rag.router.answer.Enhancer;
import ch.so.arp.rag.router.answer.Synthesizer;
import ch.so.arp.rag.router.classify.Classification;
import ch.so.arp.rag.router.classify.KeywordQueryClassifier;
import ch.so.arp.rag.router.classify.QueryClassifier;
import ch.so.arp.rag.router.embedding.HashingEmbeddingProvider;
import ch.so.arp.rag.router.evaluation.ResponseEvaluator;
import ch.so.arp.rag.router.livedata.LiveDataBranch;
import ch.so.arp.rag.router.livedata.LiveDataError;
import ch.so.arp.rag.router.livedata.LiveDataException;
import ch.so.arp.rag.router.livedata.LiveDataProvider;
import ch.so.arp.rag.router.livedata.LocationExtractor;
import ch.so.arp.rag.router.livedata.MockLiveDataProvider;
import ch.so.arp.rag.router.llm.GenerationOptions;
import ch.so.arp.rag.router.llm.InferenceEngine;
import ch.so.arp.rag.router.llm.InferenceException;
import ch.so.arp.rag.router.llm.MockInferenceEngine;
import ch.so.arp.rag.router.retrieval.RetrievalBranch;
import ch.so.arp.rag.router.storage.StorageWriter;
import ch.so.arp.rag.router.support.TimeLimitedExecutor;
import ch.so.arp.rag.router.vector.InMemoryVectorStore;
import ch.so.arp.rag.router.vector.StorageException;
import ch.so.arp.rag.router.vector.VectorMatch;
import ch.so.arp.rag.router.vector.VectorStore;

class QueryOrchestratorTest {

    private final ExecutorService executorService = Executors.newCachedThreadPool();
    private final ExecutorService storageThread = Executors.newSingleThreadExecutor();
    private final TimeLimitedExecutor timeLimitedExecutor = new TimeLimitedExecutor(executorService);
    private final HashingEmbeddingProvider embeddingProvider = new HashingEmbeddingProvider(1024);
    private final InMemoryVectorStore store = new InMemoryVectorStore();
    private final RouterProperties properties = new RouterProperties();

    private QueryClassifier classifier = new KeywordQueryClassifier();
    private LiveDataProvider liveDataProvider = new MockLiveDataProvider();
    private InferenceEngine inferenceEngine = new MockInferenceEngine();
    private VectorStore vectorStore = store;
    private Executor storageExecutor = Runnable::run;
    private Duration liveDataTimeout = Duration.ofSeconds(5);
    private Duration retrievalTimeout = Duration.ofSeconds(5);
    private Duration enhancementTimeout = Duration.ofSeconds(5);

    @AfterEach
    void shutdown() {
        executorService.shutdownNow();
        storageThread.shutdownNow();
    }

    @Test
    void answersWeatherQuestionFromLiveData() {
        QueryResult result = orchestrator().process("What's the weather in Paris?");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.classification()).isEqualTo(Classification.LIVE_DATA);
        assertThat(result.response()).contains("Paris").contains("Current weather in Paris");
        assertThat(result.stored()).isTrue();
        assertThat(store.size()).isEqualTo(1);
        assertThat(result.evaluation()).isNotNull();
        assertThat(result.evaluation().aggregate()).isBetween(0.0d, 1.0d);
        assertThat(result.degradations()).isEmpty();
        assertThat(result.requestId()).isNotBlank();
    }

    @Test
    void answersWithNoInformationWhenStoreIsEmpty() {
        QueryResult result = orchestrator().process("Summarize the uploaded report");

        assertThat(result.classification()).isEqualTo(Classification.RETRIEVAL);
        assertThat(result.response()).isEqualTo(Synthesizer.NO_INFORMATION_ANSWER);
        assertThat(result.stored()).isTrue();
        assertThat(result.error()).isNull();
        assertThat(result.degradations()).containsExactly(Degradation.EMPTY_EVIDENCE);
    }

    @Test
    void noInformationAnswersCanBeKeptOutOfTheStore() {
        properties.getStorage().setStoreFallbackAnswers(false);

        QueryResult result = orchestrator().process("Summarize the uploaded report");

        assertThat(result.stored()).isFalse();
        assertThat(store.size()).isZero();
    }

    @Test
    void liveDataTimeoutFailsLiveDataQuery() {
        liveDataProvider = request -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return null;
        };
        liveDataTimeout = Duration.ofMillis(50);

        QueryResult result = orchestrator().process("What's the weather in Paris?");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.errorCode()).isEqualTo("live_data.upstream_unavailable");
        assertThat(result.error()).contains("upstream_unavailable");
        assertThat(result.response()).isEmpty();
        assertThat(result.stored()).isFalse();
        assertThat(result.evaluation()).isNull();
        assertThat(store.size()).isZero();
    }

    @Test
    void keepsDraftWhenEnhancementFails() {
        inferenceEngine = (prompt, options) -> {
            if (prompt.startsWith("Improve")) {
                throw InferenceException.engineUnavailable("enhancement model offline", null);
            }
            return "Draft about Paris";
        };

        QueryResult result = orchestrator().process("What's the weather in Paris?");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.response()).isEqualTo("Draft about Paris");
        assertThat(result.degradations()).containsExactly(Degradation.ENHANCEMENT_FAILED);
        assertThat(result.stored()).isTrue();
    }

    @Test
    void keepsDraftWhenEnhancementTimesOut() {
        inferenceEngine = (prompt, options) -> {
            if (prompt.startsWith("Improve")) {
                sleep(2_000);
                return "too late";
            }
            return "Draft about Paris";
        };
        enhancementTimeout = Duration.ofMillis(50);

        QueryResult result = orchestrator().process("What's the weather in Paris?");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.response()).isEqualTo("Draft about Paris");
        assertThat(result.degradations()).containsExactly(Degradation.ENHANCEMENT_FAILED);
    }

    @Test
    void synthesisFailureIsFatal() {
        inferenceEngine = (prompt, options) -> {
            throw InferenceException.engineUnavailable("HTTP 503", null);
        };

        QueryResult result = orchestrator().process("What's the weather in Paris?");

        assertThat(result.errorCode()).isEqualTo("synthesis.engine_unavailable");
        assertThat(result.response()).isEmpty();
        assertThat(result.stored()).isFalse();
        assertThat(store.size()).isZero();
    }

    @Test
    void mixedQueryDegradesWhenLiveDataFails() {
        store.upsert("The uploaded report covers weather stations",
                embeddingProvider.embed("The uploaded report covers weather stations"),
                Map.of("source", "report.pdf"));
        liveDataProvider = request -> {
            throw new LiveDataException(LiveDataError.NOT_FOUND, "Unknown location " + request.location());
        };

        QueryResult result = orchestrator().process("Does the uploaded report match the weather in Atlantis?");

        assertThat(result.classification()).isEqualTo(Classification.MIXED);
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.degradations()).containsExactly(Degradation.LIVE_DATA_UNAVAILABLE);
        assertThat(result.response()).contains("[document: report.pdf]");
    }

    @Test
    void mixedQueryCombinesBothBranches() {
        store.upsert("The uploaded report covers weather stations",
                embeddingProvider.embed("The uploaded report covers weather stations"),
                Map.of("source", "report.pdf"));

        QueryResult result = orchestrator().process("Does the uploaded report match the weather in Bern?");

        assertThat(result.degradations()).isEmpty();
        assertThat(result.response()).contains("[live_data]").contains("[document: report.pdf]");
    }

    @Test
    void unclassifiedQueryIsAnsweredFromRetrieval() {
        QueryResult result = orchestrator().process("hello there");

        assertThat(result.classification()).isEqualTo(Classification.UNCLASSIFIED);
        assertThat(result.degradations())
                .containsExactly(Degradation.CLASSIFICATION_AMBIGUOUS, Degradation.EMPTY_EVIDENCE);
        assertThat(result.response()).isEqualTo(Synthesizer.NO_INFORMATION_ANSWER);
    }

    @Test
    void storeFailureDuringRetrievalDegrades() {
        vectorStore = new VectorStore() {
            @Override
            public List<VectorMatch> search(float[] embedding, int topK) {
                throw new StorageException("connection refused");
            }

            @Override
            public void upsert(String text, float[] embedding, Map<String, Object> metadata) {
                store.upsert(text, embedding, metadata);
            }
        };

        QueryResult result = orchestrator().process("What is spatial planning?");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.degradations())
                .containsExactly(Degradation.RETRIEVAL_UNAVAILABLE, Degradation.EMPTY_EVIDENCE);
    }

    @Test
    void slowStoreDuringRetrievalDegrades() {
        vectorStore = new VectorStore() {
            @Override
            public List<VectorMatch> search(float[] embedding, int topK) {
                sleep(2_000);
                return List.of();
            }

            @Override
            public void upsert(String text, float[] embedding, Map<String, Object> metadata) {
                store.upsert(text, embedding, metadata);
            }
        };
        retrievalTimeout = Duration.ofMillis(50);

        QueryResult result = orchestrator().process("Summarize the uploaded report");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.response()).isEqualTo(Synthesizer.NO_INFORMATION_ANSWER);
        assertThat(result.degradations())
                .containsExactly(Degradation.RETRIEVAL_UNAVAILABLE, Degradation.EMPTY_EVIDENCE);
    }

    @Test
    void storageRunsAfterTheAnswerIsReturned() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(1);
        vectorStore = new VectorStore() {
            @Override
            public List<VectorMatch> search(float[] embedding, int topK) {
                return List.of();
            }

            @Override
            public void upsert(String text, float[] embedding, Map<String, Object> metadata) {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                } finally {
                    finished.countDown();
                }
                throw new StorageException("disk full");
            }
        };
        storageExecutor = storageThread;

        QueryResult result = orchestrator().process("What's the weather in Paris?");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.stored()).isTrue();
        assertThat(result.degradations()).isEmpty();
        assertThat(finished.getCount()).isEqualTo(1);

        release.countDown();
        assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void rejectedStorageIsReported() {
        storageExecutor = task -> {
            throw new RejectedExecutionException("queue full");
        };

        QueryResult result = orchestrator().process("What's the weather in Paris?");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.stored()).isFalse();
        assertThat(result.degradations()).containsExactly(Degradation.STORAGE_REJECTED);
    }

    @Test
    void evaluationCanBeDeferred() {
        properties.getEvaluation().setInline(false);

        assertThat(orchestrator().process("What's the weather in Paris?").evaluation()).isNull();
    }

    @Test
    void unexpectedFailureIsInternalError() {
        classifier = query -> {
            throw new IllegalStateException("classifier crashed");
        };

        QueryResult result = orchestrator().process("What's the weather in Paris?");

        assertThat(result.errorCode()).isEqualTo(QueryOrchestrator.INTERNAL_ERROR);
        assertThat(result.classification()).isEqualTo(Classification.UNCLASSIFIED);
        assertThat(result.stored()).isFalse();
    }

    @Test
    void describesItself() {
        RouterInfo info = orchestrator().info();

        assertThat(info.capabilities()).contains("Query classification", "Weather data");
        assertThat(info.model()).isEqualTo("mock-inference");
    }

    private QueryOrchestrator orchestrator() {
        Duration timeout = Duration.ofSeconds(5);
        return new QueryOrchestrator(
                classifier,
                new LiveDataBranch(liveDataProvider, new LocationExtractor(), timeLimitedExecutor, liveDataTimeout),
                new RetrievalBranch(embeddingProvider, vectorStore, timeLimitedExecutor, retrievalTimeout, 0.2d),
                new Synthesizer(inferenceEngine, timeLimitedExecutor, timeout, new GenerationOptions(0.3d, 300),
                        6000),
                new Enhancer(inferenceEngine, timeLimitedExecutor, enhancementTimeout,
                        new GenerationOptions(0.3d, 400)),
                new StorageWriter(embeddingProvider, vectorStore, inferenceEngine.modelId(), storageExecutor,
                        timeLimitedExecutor, timeout),
                new ResponseEvaluator(),
                inferenceEngine,
                properties);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}

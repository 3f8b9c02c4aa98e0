package ch.so.arp.rag.router.pipeline;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import ch.so.arp.rag.router.Query;
import ch.so.arp.rag.router.RouterProperties;
import ch.so.arp.rag.router.answer.EnhancementException;
import ch.so.arp.rag.router.answer.Enhancer;
import ch.so.arp.rag.router.answer.Evidence;
import ch.so.arp.rag.router.answer.SynthesisException;
import ch.so.arp.rag.router.answer.Synthesizer;
import ch.so.arp.rag.router.classify.Classification;
import ch.so.arp.rag.router.classify.QueryClassifier;
import ch.so.arp.rag.router.embedding.EmbeddingException;
import ch.so.arp.rag.router.evaluation.EvaluationResult;
import ch.so.arp.rag.router.evaluation.ResponseEvaluator;
import ch.so.arp.rag.router.livedata.LiveDataBranch;
import ch.so.arp.rag.router.livedata.LiveDataResult;
import ch.so.arp.rag.router.llm.InferenceEngine;
import ch.so.arp.rag.router.retrieval.ContextWindow;
import ch.so.arp.rag.router.retrieval.RetrievalBranch;
import ch.so.arp.rag.router.storage.StorageWriter;
import ch.so.arp.rag.router.support.StageTimeoutException;
import ch.so.arp.rag.router.vector.StorageException;

/**
 * Runs a query through the pipeline: classify, collect evidence, synthesize,
 * enhance, hand the answer to storage and evaluate it.
 * <p>
 * The orchestrator keeps no per-request state, concurrent calls to
 * {@link #process(String)} are independent.
 */
@Service
public class QueryOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(QueryOrchestrator.class);

    static final String INTERNAL_ERROR = "internal_error";

    private final QueryClassifier classifier;
    private final LiveDataBranch liveDataBranch;
    private final RetrievalBranch retrievalBranch;
    private final Synthesizer synthesizer;
    private final Enhancer enhancer;
    private final StorageWriter storageWriter;
    private final ResponseEvaluator evaluator;
    private final InferenceEngine inferenceEngine;
    private final RouterProperties properties;

    public QueryOrchestrator(QueryClassifier classifier, LiveDataBranch liveDataBranch,
            RetrievalBranch retrievalBranch, Synthesizer synthesizer, Enhancer enhancer, StorageWriter storageWriter,
            ResponseEvaluator evaluator, InferenceEngine inferenceEngine, RouterProperties properties) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.liveDataBranch = Objects.requireNonNull(liveDataBranch, "liveDataBranch");
        this.retrievalBranch = Objects.requireNonNull(retrievalBranch, "retrievalBranch");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
        this.enhancer = Objects.requireNonNull(enhancer, "enhancer");
        this.storageWriter = Objects.requireNonNull(storageWriter, "storageWriter");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.inferenceEngine = Objects.requireNonNull(inferenceEngine, "inferenceEngine");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    public QueryResult process(String text) {
        Query query = Query.of(text);
        PipelineTrace trace = PipelineTrace.start();
        Classification classification = Classification.UNCLASSIFIED;
        try {
            classification = trace.stage("classification", () -> classifier.classify(query.text()));
            LOGGER.debug("[{}] Classified query as {}", trace.requestId(), classification.tag());
            if (classification == Classification.UNCLASSIFIED) {
                trace.degrade(Degradation.CLASSIFICATION_AMBIGUOUS, "no intent recognized, using retrieval");
            }
            QueryResult result = answer(query, classification, trace);
            LOGGER.info("[{}] Processed query as {} in {} ms: {}; stages: {}", trace.requestId(),
                    classification.tag(), trace.elapsedMillis(), result.isSuccess() ? "ok" : result.errorCode(),
                    trace.summary());
            return result;
        } catch (RuntimeException ex) {
            LOGGER.error("[{}] Unexpected failure while processing '{}': {}", trace.requestId(), query.text(),
                    ex.getMessage(), ex);
            return QueryResult.failure(classification, INTERNAL_ERROR,
                    "Internal error while processing the query: " + ex.getMessage(), trace);
        }
    }

    public RouterInfo info() {
        return new RouterInfo(
                List.of("Live data service", "Retrieval service", "Inference service"),
                List.of("Query classification", "Weather data", "Document search", "Response enhancement",
                        "Processed data storage", "Response evaluation"),
                inferenceEngine.modelId());
    }

    private QueryResult answer(Query query, Classification classification, PipelineTrace trace) {
        Evidence evidence;
        switch (EvidenceRoute.of(classification)) {
            case LIVE_DATA -> {
                LiveDataResult live = trace.stage("live-data", () -> liveDataBranch.fetchLive(query.text()));
                if (!live.isSuccess()) {
                    String code = "live_data." + live.error().code();
                    LOGGER.error("[{}] Live data unavailable ({}): {}", trace.requestId(), live.error().code(),
                            live.detail());
                    return QueryResult.failure(classification, code,
                            "Live data unavailable (" + live.error().code() + "): " + live.detail(), trace);
                }
                evidence = Evidence.liveData(live.text());
            }
            case RETRIEVAL -> evidence = Evidence.retrieved(retrieve(query, trace));
            case BOTH -> {
                LiveDataResult live = trace.stage("live-data", () -> liveDataBranch.fetchLive(query.text()));
                if (!live.isSuccess()) {
                    trace.degrade(Degradation.LIVE_DATA_UNAVAILABLE, live.error().code() + ": " + live.detail());
                }
                evidence = Evidence.combined(live.isSuccess() ? live.text() : null, retrieve(query, trace));
            }
            default -> throw new IllegalStateException("Unknown route for " + classification);
        }
        if (evidence.isEmpty()) {
            trace.degrade(Degradation.EMPTY_EVIDENCE, "no evidence found, answering without it");
        }

        String draft;
        try {
            Evidence collected = evidence;
            draft = trace.stage("synthesis",
                    () -> synthesizer.synthesize(query.text(), classification, collected));
        } catch (SynthesisException ex) {
            String code = "synthesis." + ex.getKind().code();
            LOGGER.error("[{}] Synthesis failed ({}): {}", trace.requestId(), ex.getKind().code(), ex.getMessage());
            return QueryResult.failure(classification, code, "Could not generate an answer: " + ex.getMessage(),
                    trace);
        }

        boolean noInformation = Synthesizer.isNoInformationAnswer(draft);
        String response = enhance(draft, noInformation, trace);
        boolean stored = store(query, response, classification, noInformation, trace);
        EvaluationResult evaluation = null;
        if (properties.getEvaluation().isInline()) {
            evaluation = trace.stage("evaluation", () -> evaluator.evaluate(query.text(), response));
        } else {
            trace.skip("evaluation");
        }
        return QueryResult.success(response, classification, evaluation, stored, trace);
    }

    private ContextWindow retrieve(Query query, PipelineTrace trace) {
        int topK = properties.getRetrieval().getTopK();
        try {
            return trace.stage("retrieval",
                    () -> ContextWindow.assemble(retrievalBranch.retrieve(query.text(), topK), topK));
        } catch (StorageException | EmbeddingException | StageTimeoutException ex) {
            trace.degrade(Degradation.RETRIEVAL_UNAVAILABLE, ex.getMessage());
            return ContextWindow.empty();
        }
    }

    private String enhance(String draft, boolean noInformation, PipelineTrace trace) {
        if (noInformation || !properties.getEnhancement().isEnabled()) {
            trace.skip("enhancement");
            return draft;
        }
        try {
            return trace.stage("enhancement", () -> enhancer.enhance(draft));
        } catch (EnhancementException ex) {
            trace.degrade(Degradation.ENHANCEMENT_FAILED, ex.getMessage());
            return draft;
        }
    }

    private boolean store(Query query, String response, Classification classification, boolean noInformation,
            PipelineTrace trace) {
        RouterProperties.Storage storage = properties.getStorage();
        if (!storage.isEnabled() || (noInformation && !storage.isStoreFallbackAnswers())) {
            trace.skip("storage");
            return false;
        }
        boolean accepted = trace.stage("storage",
                () -> storageWriter.submit(trace.requestId(), query, response, classification));
        if (!accepted) {
            trace.degrade(Degradation.STORAGE_REJECTED, "interaction was not stored");
        }
        return accepted;
    }
}

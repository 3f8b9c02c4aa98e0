package ch.so.arp.rag.router.pipeline;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import ch.so.arp.rag.router.classify.Classification;
import ch.so.arp.rag.router.evaluation.EvaluationResult;

/**
 * Outcome of one pipeline run. On fatal errors {@code response} is empty,
 * {@code stored} is false and {@code error}/{@code errorCode} are set.
 */
public record QueryResult(String response, Classification classification, EvaluationResult evaluation,
        boolean stored, String error, String errorCode, Set<Degradation> degradations, String requestId) {

    public QueryResult {
        EnumSet<Degradation> copy = EnumSet.noneOf(Degradation.class);
        copy.addAll(degradations);
        degradations = Collections.unmodifiableSet(copy);
    }

    static QueryResult success(String response, Classification classification, EvaluationResult evaluation,
            boolean stored, PipelineTrace trace) {
        return new QueryResult(response, classification, evaluation, stored, null, null, trace.degradations(),
                trace.requestId());
    }

    static QueryResult failure(Classification classification, String errorCode, String error, PipelineTrace trace) {
        return new QueryResult("", classification, null, false, error, errorCode, trace.degradations(),
                trace.requestId());
    }

    public boolean isSuccess() {
        return error == null;
    }
}

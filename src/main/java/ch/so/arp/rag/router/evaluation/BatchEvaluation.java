package ch.so.arp.rag.router.evaluation;

import java.util.List;

public record BatchEvaluation(List<EvaluationResult> results, EvaluationSummary summary) {

    public BatchEvaluation {
        results = List.copyOf(results);
    }
}

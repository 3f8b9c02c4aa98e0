package ch.so.arp.rag.router.evaluation;

import java.util.Map;

/**
 * Statistics over the aggregates of a batch. All values are zero for an empty
 * batch.
 */
public record EvaluationSummary(int count, double mean, double min, double max,
        Map<String, Double> criterionAverages) {

    public EvaluationSummary {
        criterionAverages = Map.copyOf(criterionAverages);
    }

    public static EvaluationSummary empty() {
        return new EvaluationSummary(0, 0.0d, 0.0d, 0.0d, Map.of());
    }
}

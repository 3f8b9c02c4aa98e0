package ch.so.arp.rag.router.evaluation;

import java.util.List;
import java.util.Optional;

/**
 * Per-criterion scores and their weighted mean.
 */
public record EvaluationResult(List<CriterionScore> scores, double aggregate) {

    public EvaluationResult {
        scores = List.copyOf(scores);
    }

    public Optional<CriterionScore> score(String criterion) {
        return scores.stream().filter(score -> score.criterion().equals(criterion)).findFirst();
    }
}

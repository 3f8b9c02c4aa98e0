package ch.so.arp.rag.router.evaluation;

import java.util.ArrayList;
import java.util.DoubleSummaryStatistics;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores responses with a fixed set of heuristic criteria. Evaluation is pure:
 * the same query and response always give the same result.
 */
public class ResponseEvaluator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResponseEvaluator.class);

    private final List<CriterionScorer> scorers;

    public ResponseEvaluator() {
        this(List.of(new RelevanceScorer(), new AccuracyScorer(), new HelpfulnessScorer()));
    }

    public ResponseEvaluator(List<CriterionScorer> scorers) {
        Objects.requireNonNull(scorers, "scorers");
        if (scorers.isEmpty()) {
            throw new IllegalArgumentException("At least one scorer is required");
        }
        this.scorers = List.copyOf(scorers);
    }

    public EvaluationResult evaluate(String query, String response) {
        String safeQuery = query == null ? "" : query;
        String safeResponse = response == null ? "" : response;
        List<CriterionScore> scores = new ArrayList<>(scorers.size());
        double weightedSum = 0.0d;
        double totalWeight = 0.0d;
        for (CriterionScorer scorer : scorers) {
            CriterionScore score = scorer.score(safeQuery, safeResponse);
            scores.add(score);
            weightedSum += score.score() * scorer.weight();
            totalWeight += scorer.weight();
        }
        double aggregate = totalWeight > 0.0d ? weightedSum / totalWeight : 0.0d;
        LOGGER.debug("Evaluated response of {} chars: aggregate {}", safeResponse.length(), aggregate);
        return new EvaluationResult(scores, aggregate);
    }

    public BatchEvaluation evaluateBatch(List<EvaluationRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            return new BatchEvaluation(List.of(), EvaluationSummary.empty());
        }
        List<EvaluationResult> results = requests.stream()
                .map(request -> request == null ? evaluate("", "") : evaluate(request.query(), request.response()))
                .toList();
        DoubleSummaryStatistics statistics = results.stream()
                .mapToDouble(EvaluationResult::aggregate)
                .summaryStatistics();
        Map<String, Double> averages = new LinkedHashMap<>();
        for (CriterionScorer scorer : scorers) {
            averages.put(scorer.name(), results.stream()
                    .flatMap(result -> result.score(scorer.name()).stream())
                    .collect(Collectors.averagingDouble(CriterionScore::score)));
        }
        return new BatchEvaluation(results, new EvaluationSummary((int) statistics.getCount(),
                statistics.getAverage(), statistics.getMin(), statistics.getMax(), averages));
    }
}

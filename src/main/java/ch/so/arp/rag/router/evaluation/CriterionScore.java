package ch.so.arp.rag.router.evaluation;

/**
 * Score of one criterion in [0,1] with a short human readable reasoning.
 */
public record CriterionScore(String criterion, double score, String reasoning) {

    public CriterionScore {
        if (criterion == null || criterion.isBlank()) {
            throw new IllegalArgumentException("criterion must not be blank");
        }
        if (score < 0.0d || score > 1.0d || Double.isNaN(score)) {
            throw new IllegalArgumentException("score must be within [0,1]: " + score);
        }
        reasoning = reasoning == null ? "" : reasoning;
    }
}

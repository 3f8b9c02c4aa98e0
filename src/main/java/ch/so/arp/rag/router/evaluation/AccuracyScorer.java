package ch.so.arp.rag.router.evaluation;

/**
 * Uses response length as a rough proxy for how complete an answer is.
 */
public class AccuracyScorer implements CriterionScorer {

    static final String NAME = "accuracy";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CriterionScore score(String query, String response) {
        int words = Tokens.words(response).size();
        if (words == 0) {
            return new CriterionScore(NAME, 0.0d, "empty response");
        }
        if (words < 5) {
            return new CriterionScore(NAME, 0.3d, "very short response (%d words)".formatted(words));
        }
        if (words < 20) {
            return new CriterionScore(NAME, 0.7d, "moderate response length (%d words)".formatted(words));
        }
        return new CriterionScore(NAME, 0.9d, "detailed response (%d words)".formatted(words));
    }
}

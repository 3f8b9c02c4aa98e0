package ch.so.arp.rag.router.evaluation;

import java.util.Set;

/**
 * Share of distinct query words that also occur in the response.
 */
public class RelevanceScorer implements CriterionScorer {

    static final String NAME = "relevance";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CriterionScore score(String query, String response) {
        Set<String> queryTokens = Tokens.distinctLowerCase(query);
        if (queryTokens.isEmpty()) {
            return new CriterionScore(NAME, 0.5d, "no query provided");
        }
        Set<String> responseTokens = Tokens.distinctLowerCase(response);
        long overlap = queryTokens.stream().filter(responseTokens::contains).count();
        double score = Math.min(1.0d, (double) overlap / queryTokens.size());
        return new CriterionScore(NAME, score,
                "%d of %d query terms found in the response".formatted(overlap, queryTokens.size()));
    }
}

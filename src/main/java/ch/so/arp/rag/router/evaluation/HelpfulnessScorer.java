package ch.so.arp.rag.router.evaluation;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Counts explanatory marker words and adjusts for very long or very short
 * responses. Markers match whole words, a possessive or contracted {@code 's}
 * ("here's") still counts.
 */
public class HelpfulnessScorer implements CriterionScorer {

    static final String NAME = "helpfulness";

    static final Set<String> MARKERS = Set.of("here", "this", "information", "details", "explanation", "because",
            "therefore", "however", "additionally", "furthermore");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CriterionScore score(String query, String response) {
        List<String> words = Tokens.words(response);
        if (words.isEmpty()) {
            return new CriterionScore(NAME, 0.0d, "empty response");
        }
        Set<String> tokens = words.stream()
                .map(word -> word.toLowerCase(Locale.ROOT).replaceAll("^\\W+|\\W+$", ""))
                .map(word -> word.replaceAll("['\u2019]s$", ""))
                .collect(Collectors.toSet());
        long markers = MARKERS.stream().filter(tokens::contains).count();
        double score = Math.min(0.8d, 0.3d + 0.1d * markers);
        if (words.size() > 50) {
            score = Math.min(1.0d, score + 0.2d);
        } else if (words.size() < 10) {
            score = Math.max(0.2d, score - 0.2d);
        }
        return new CriterionScore(NAME, score,
                "%d helpful markers in %d words".formatted(markers, words.size()));
    }
}

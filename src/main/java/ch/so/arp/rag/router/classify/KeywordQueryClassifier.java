package ch.so.arp.rag.router.classify;

import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rule based classifier matching whole words and phrases against three cue
 * lists. Weather cues select live data, document cues and general knowledge
 * cues select retrieval, and weather combined with a document cue is mixed.
 */
public class KeywordQueryClassifier implements QueryClassifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(KeywordQueryClassifier.class);

    private static final List<String> LIVE_DATA_CUES = List.of(
            "weather", "temperature", "forecast", "climate", "rain", "raining", "snow", "snowing", "wind",
            "windy", "humidity", "sunny", "degrees");

    private static final List<String> DOCUMENT_CUES = List.of(
            "document", "documents", "report", "uploaded", "file", "pdf", "summarize", "summarise", "summary",
            "according to", "in the docs");

    private static final List<String> KNOWLEDGE_CUES = List.of(
            "what is", "what are", "explain", "tell me about", "how does", "how do", "define", "describe",
            "information about", "details about", "learn about", "who is", "why");

    @Override
    public Classification classify(String query) {
        if (query == null || query.isBlank()) {
            return Classification.UNCLASSIFIED;
        }
        String normalized = normalize(query);
        boolean liveData = containsAny(normalized, LIVE_DATA_CUES);
        boolean document = containsAny(normalized, DOCUMENT_CUES);
        boolean knowledge = containsAny(normalized, KNOWLEDGE_CUES);

        Classification classification;
        if (liveData && document) {
            classification = Classification.MIXED;
        } else if (liveData) {
            classification = Classification.LIVE_DATA;
        } else if (document || knowledge) {
            classification = Classification.RETRIEVAL;
        } else {
            classification = Classification.UNCLASSIFIED;
        }
        LOGGER.debug("Keyword classification of '{}' is {}", query, classification.tag());
        return classification;
    }

    private String normalize(String query) {
        // padded so that every cue can be matched as " cue "
        String collapsed = query.toLowerCase(Locale.ROOT)
                .replaceAll("['’]s\\b", " is")
                .replaceAll("[^\\p{L}\\p{N}]+", " ")
                .trim();
        return " " + collapsed + " ";
    }

    private boolean containsAny(String normalized, List<String> cues) {
        for (String cue : cues) {
            if (normalized.contains(" " + cue + " ")) {
                return true;
            }
        }
        return false;
    }
}

package ch.so.arp.rag.router.classify;

import java.time.Duration;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.router.llm.GenerationOptions;
import ch.so.arp.rag.router.llm.InferenceEngine;
import ch.so.arp.rag.router.support.TimeLimitedExecutor;

/**
 * Classifier asking the inference engine for the intent. The engine is called
 * with temperature zero; whenever it fails, times out or answers with anything
 * but a definite tag, the keyword classifier decides instead.
 */
public class InferenceQueryClassifier implements QueryClassifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(InferenceQueryClassifier.class);

    private static final GenerationOptions OPTIONS = GenerationOptions.deterministic(5);

    private static final String PROMPT = """
            Classify the query into exactly one category and respond with only the category name.

            Categories:
            - live_data: current weather, temperature, forecast or other location-specific live conditions
            - retrieval: general knowledge, documents, explanations, definitions or summaries
            - mixed: needs both live conditions and document knowledge
            - unclassified: none of the above

            Examples:
            - "What's the weather in New York?" -> live_data
            - "What is machine learning?" -> retrieval
            - "Does the uploaded report's forecast match today's weather in Bern?" -> mixed

            Query: %s
            """;

    private final InferenceEngine inferenceEngine;
    private final QueryClassifier fallback;
    private final TimeLimitedExecutor timeLimitedExecutor;
    private final Duration timeout;

    public InferenceQueryClassifier(InferenceEngine inferenceEngine, QueryClassifier fallback,
            TimeLimitedExecutor timeLimitedExecutor, Duration timeout) {
        this.inferenceEngine = Objects.requireNonNull(inferenceEngine, "inferenceEngine");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
        this.timeLimitedExecutor = Objects.requireNonNull(timeLimitedExecutor, "timeLimitedExecutor");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public Classification classify(String query) {
        if (query == null || query.isBlank()) {
            return Classification.UNCLASSIFIED;
        }
        try {
            String answer = timeLimitedExecutor.call("classification", timeout,
                    () -> inferenceEngine.generate(PROMPT.formatted(query.trim()), OPTIONS));
            Classification classification = Classification.fromTag(firstWord(answer));
            if (classification != Classification.UNCLASSIFIED) {
                return classification;
            }
            LOGGER.debug("Model gave no definite category for '{}', using keywords", query);
        } catch (RuntimeException ex) {
            LOGGER.warn("Model classification failed, using keywords: {}", ex.getMessage());
        }
        return fallback.classify(query);
    }

    private String firstWord(String answer) {
        if (answer == null) {
            return "";
        }
        String trimmed = answer.trim();
        int end = 0;
        while (end < trimmed.length() && !Character.isWhitespace(trimmed.charAt(end))
                && trimmed.charAt(end) != '.') {
            end++;
        }
        return trimmed.substring(0, end);
    }
}

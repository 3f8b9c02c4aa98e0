package ch.so.arp.rag.router.answer;

import java.time.Duration;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.router.classify.Classification;
import ch.so.arp.rag.router.llm.GenerationOptions;
import ch.so.arp.rag.router.llm.InferenceEngine;
import ch.so.arp.rag.router.llm.InferenceException;
import ch.so.arp.rag.router.support.StageTimeoutException;
import ch.so.arp.rag.router.support.TimeLimitedExecutor;

/**
 * Combines the query and the collected evidence into a prompt and obtains the
 * draft answer from the inference engine.
 */
public class Synthesizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(Synthesizer.class);

    /**
     * Answer given when neither branch produced any evidence. Returned without
     * consulting the model.
     */
    public static final String NO_INFORMATION_ANSWER = "No information available: I could not find any data to "
            + "answer your question. Please try rephrasing it or ask about a different topic.";

    private static final String PROMPT = """
            Answer the question using only the evidence below. Each evidence block starts with a marker \
            telling where it came from: [live_data] for current measurements, [document: ...] for \
            ingested documents and [prior_response: ...] for earlier answers. Prefer documents and live data \
            over earlier answers. If the evidence does not answer the question, say so instead of guessing.
            Question type: %s
            ---
            Question: %s

            Evidence:
            %s
            """;

    private static final String TRUNCATION_MARKER = "\n[evidence truncated]";

    private final InferenceEngine inferenceEngine;
    private final TimeLimitedExecutor timeLimitedExecutor;
    private final Duration timeout;
    private final GenerationOptions options;
    private final int maxEvidenceChars;

    public Synthesizer(InferenceEngine inferenceEngine, TimeLimitedExecutor timeLimitedExecutor, Duration timeout,
            GenerationOptions options, int maxEvidenceChars) {
        this.inferenceEngine = Objects.requireNonNull(inferenceEngine, "inferenceEngine");
        this.timeLimitedExecutor = Objects.requireNonNull(timeLimitedExecutor, "timeLimitedExecutor");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.options = Objects.requireNonNull(options, "options");
        this.maxEvidenceChars = maxEvidenceChars;
    }

    public static boolean isNoInformationAnswer(String answer) {
        return NO_INFORMATION_ANSWER.equals(answer);
    }

    /**
     * @throws SynthesisException if the engine is unavailable or returns no
     *                            content
     */
    public String synthesize(String query, Classification classification, Evidence evidence) {
        if (evidence == null || evidence.isEmpty()) {
            LOGGER.debug("No evidence for '{}', answering without the model", query);
            return NO_INFORMATION_ANSWER;
        }
        String prompt = buildPrompt(query, classification, evidence);
        String completion;
        try {
            completion = timeLimitedExecutor.call("synthesis", timeout,
                    () -> inferenceEngine.generate(prompt, options));
        } catch (InferenceException ex) {
            SynthesisException.Kind kind = ex.getKind() == InferenceException.Kind.EMPTY_COMPLETION
                    ? SynthesisException.Kind.EMPTY_COMPLETION
                    : SynthesisException.Kind.ENGINE_UNAVAILABLE;
            throw new SynthesisException(kind, ex.getMessage(), ex);
        } catch (StageTimeoutException ex) {
            throw new SynthesisException(SynthesisException.Kind.ENGINE_UNAVAILABLE, ex.getMessage(), ex);
        }
        if (completion == null || completion.isBlank()) {
            throw new SynthesisException(SynthesisException.Kind.EMPTY_COMPLETION,
                    "Inference engine returned an empty draft", null);
        }
        return completion.strip();
    }

    String buildPrompt(String query, Classification classification, Evidence evidence) {
        String formatted = evidence.formatForPrompt();
        if (formatted.length() > maxEvidenceChars) {
            formatted = formatted.substring(0, Math.max(0, maxEvidenceChars)) + TRUNCATION_MARKER;
        }
        return PROMPT.formatted(classification.tag(), query.strip(), formatted);
    }
}

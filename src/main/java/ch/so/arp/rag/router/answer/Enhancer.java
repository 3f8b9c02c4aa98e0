package ch.so.arp.rag.router.answer;

import java.time.Duration;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.router.llm.GenerationOptions;
import ch.so.arp.rag.router.llm.InferenceEngine;
import ch.so.arp.rag.router.support.TimeLimitedExecutor;

/**
 * Second inference pass that improves clarity and structure of a draft answer
 * without adding new claims.
 */
public class Enhancer {

    private static final Logger LOGGER = LoggerFactory.getLogger(Enhancer.class);

    private static final String PROMPT = """
            Improve the clarity, structure and readability of the answer below. Keep its meaning. \
            Do not add facts, numbers or claims that are not already in the answer, and do not remove \
            information. Return only the improved answer.
            ---
            %s
            """;

    private final InferenceEngine inferenceEngine;
    private final TimeLimitedExecutor timeLimitedExecutor;
    private final Duration timeout;
    private final GenerationOptions options;

    public Enhancer(InferenceEngine inferenceEngine, TimeLimitedExecutor timeLimitedExecutor, Duration timeout,
            GenerationOptions options) {
        this.inferenceEngine = Objects.requireNonNull(inferenceEngine, "inferenceEngine");
        this.timeLimitedExecutor = Objects.requireNonNull(timeLimitedExecutor, "timeLimitedExecutor");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * @throws EnhancementException on engine failure, timeout or a blank result
     */
    public String enhance(String draft) {
        if (draft == null || draft.isBlank()) {
            throw new EnhancementException("Nothing to enhance", null);
        }
        String completion;
        try {
            completion = timeLimitedExecutor.call("enhancement", timeout,
                    () -> inferenceEngine.generate(PROMPT.formatted(draft.strip()), options));
        } catch (RuntimeException ex) {
            throw new EnhancementException("Enhancement failed: " + ex.getMessage(), ex);
        }
        if (completion == null || completion.isBlank()) {
            throw new EnhancementException("Inference engine returned an empty enhancement", null);
        }
        LOGGER.debug("Enhanced draft of {} chars into {} chars", draft.length(), completion.length());
        return completion.strip();
    }
}

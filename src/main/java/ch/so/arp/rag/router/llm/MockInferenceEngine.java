package ch.so.arp.rag.router.llm;

import java.util.Locale;

/**
 * Deterministic {@link InferenceEngine} used in tests and local development
 * where no model endpoint should be contacted. It answers classification
 * prompts with a tag and everything else by echoing the prompt's content
 * section, so answers always stay grounded in the evidence they were given.
 */
public class MockInferenceEngine implements InferenceEngine {

    static final String MODEL_ID = "mock-inference";

    private static final String PREFIX = "[mocked answer] ";

    private static final String CONTENT_MARKER = "---";

    @Override
    public String generate(String prompt, GenerationOptions options) {
        if (prompt == null || prompt.isBlank()) {
            throw InferenceException.emptyCompletion("Mock engine received an empty prompt");
        }
        if (prompt.toLowerCase(Locale.ROOT).startsWith("classify")) {
            return "unclassified";
        }
        int marker = prompt.indexOf(CONTENT_MARKER);
        String content = marker >= 0 ? prompt.substring(marker + CONTENT_MARKER.length()) : prompt;
        String condensed = content.replaceAll("\\s+", " ").trim();
        int limit = Math.max(80, options.maxTokens() * 4);
        if (condensed.length() > limit) {
            condensed = condensed.substring(0, limit);
        }
        return PREFIX + condensed;
    }

    @Override
    public String modelId() {
        return MODEL_ID;
    }
}

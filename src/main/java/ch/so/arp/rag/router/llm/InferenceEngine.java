package ch.so.arp.rag.router.llm;

/**
 * Abstraction over the language model that turns prompts into text.
 * Implementations either call a remote chat completion API or return
 * predictable completions for testing.
 */
@FunctionalInterface
public interface InferenceEngine {

    /**
     * Produce one completion for the prompt.
     *
     * @param prompt  the full prompt
     * @param options sampling options
     * @return the completion text, never blank
     * @throws InferenceException when the engine cannot be reached or returns
     *                            no content
     */
    String generate(String prompt, GenerationOptions options);

    /**
     * Identifier of the model answering the prompts, recorded alongside stored
     * interactions.
     */
    default String modelId() {
        return "unknown";
    }
}

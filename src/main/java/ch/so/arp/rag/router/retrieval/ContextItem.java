package ch.so.arp.rag.router.retrieval;

import java.util.Objects;

/**
 * A retrieved unit of evidence.
 *
 * @param text       the passage
 * @param sourceId   document name or store id the passage came from
 * @param relevance  similarity to the query in [0, 1]
 * @param provenance whether the passage is an ingested document or an earlier
 *                   answer of the pipeline
 */
public record ContextItem(String text, String sourceId, double relevance, Provenance provenance) {

    public ContextItem {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(provenance, "provenance");
        if (relevance < 0.0d || relevance > 1.0d) {
            throw new IllegalArgumentException("relevance must be within [0, 1] but was " + relevance);
        }
    }

    /**
     * Formats the item for a prompt, keeping the provenance marker right in
     * front of the text so the model can tell documents from earlier answers.
     */
    public String formatForPrompt() {
        return "[" + provenance.tag() + ": " + sourceId + "]\n" + text.strip();
    }
}

package ch.so.arp.rag.router.pipeline;

/**
 * Non-fatal conditions that lower the confidence of an answer.
 */
public enum Degradation {

    /** The classifier could not decide; retrieval was used. */
    CLASSIFICATION_AMBIGUOUS,
    /** Live data failed while retrieval still contributed. */
    LIVE_DATA_UNAVAILABLE,
    /** The vector store or the embedding model failed. */
    RETRIEVAL_UNAVAILABLE,
    /** Neither branch produced evidence. */
    EMPTY_EVIDENCE,
    /** The draft was returned unrefined. */
    ENHANCEMENT_FAILED,
    /** The storage executor did not accept the interaction. */
    STORAGE_REJECTED
}

package ch.so.arp.rag.router.retrieval;

import java.util.Map;

/**
 * Where a stored item originated from.
 */
public enum Provenance {

    DOCUMENT("document"),
    PRIOR_RESPONSE("prior_response");

    /**
     * Metadata value of {@code type} marking interactions written back by the
     * pipeline.
     */
    public static final String PROCESSED_RESPONSE_TYPE = "processed_response";

    private final String tag;

    Provenance(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    static Provenance fromMetadata(Map<String, Object> metadata) {
        return PROCESSED_RESPONSE_TYPE.equals(metadata.get("type")) ? PRIOR_RESPONSE : DOCUMENT;
    }
}

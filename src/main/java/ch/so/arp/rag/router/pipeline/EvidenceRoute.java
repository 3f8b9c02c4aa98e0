package ch.so.arp.rag.router.pipeline;

import ch.so.arp.rag.router.classify.Classification;

/**
 * Which evidence branches run for a query.
 */
public enum EvidenceRoute {

    LIVE_DATA,
    RETRIEVAL,
    BOTH;

    public static EvidenceRoute of(Classification classification) {
        return switch (classification) {
            case LIVE_DATA -> LIVE_DATA;
            case MIXED -> BOTH;
            case RETRIEVAL, UNCLASSIFIED -> RETRIEVAL;
        };
    }
}

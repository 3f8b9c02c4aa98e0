package ch.so.arp.rag.router.classify;

/**
 * Maps raw query text to an intent. Implementations are total: ambiguous,
 * blank or {@code null} input yields {@link Classification#UNCLASSIFIED}
 * rather than an exception.
 */
@FunctionalInterface
public interface QueryClassifier {

    Classification classify(String query);
}

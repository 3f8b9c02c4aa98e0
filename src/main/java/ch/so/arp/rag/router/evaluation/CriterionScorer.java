package ch.so.arp.rag.router.evaluation;

/**
 * One heuristic quality criterion. Implementations must be pure functions of
 * their input and must not perform I/O.
 */
public interface CriterionScorer {

    String name();

    CriterionScore score(String query, String response);

    default double weight() {
        return 1.0d;
    }
}

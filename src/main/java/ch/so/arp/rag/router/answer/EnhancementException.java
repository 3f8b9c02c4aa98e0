package ch.so.arp.rag.router.answer;

/**
 * The refinement pass failed. Callers keep the draft.
 */
public class EnhancementException extends RuntimeException {

    public EnhancementException(String message, Throwable cause) {
        super(message, cause);
    }
}

package ch.so.arp.rag.router.llm;

/**
 * Failure of the inference engine.
 */
public class InferenceException extends RuntimeException {

    public enum Kind {
        ENGINE_UNAVAILABLE,
        EMPTY_COMPLETION
    }

    private final Kind kind;

    public InferenceException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public InferenceException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static InferenceException engineUnavailable(String message, Throwable cause) {
        return new InferenceException(Kind.ENGINE_UNAVAILABLE, message, cause);
    }

    public static InferenceException emptyCompletion(String message) {
        return new InferenceException(Kind.EMPTY_COMPLETION, message);
    }

    public Kind getKind() {
        return kind;
    }
}

package ch.so.arp.rag.router.answer;

/**
 * The draft answer could not be produced. Fatal to the request.
 */
public class SynthesisException extends RuntimeException {

    public enum Kind {

        ENGINE_UNAVAILABLE("engine_unavailable"),
        EMPTY_COMPLETION("empty_completion");

        private final String code;

        Kind(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }

    private final Kind kind;

    public SynthesisException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}

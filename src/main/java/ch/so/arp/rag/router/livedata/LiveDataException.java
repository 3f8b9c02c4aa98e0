package ch.so.arp.rag.router.livedata;

/**
 * Provider failure, already classified into a {@link LiveDataError}.
 */
public class LiveDataException extends RuntimeException {

    private final LiveDataError error;

    public LiveDataException(LiveDataError error, String message) {
        super(message);
        this.error = error;
    }

    public LiveDataException(LiveDataError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public LiveDataError getError() {
        return error;
    }
}

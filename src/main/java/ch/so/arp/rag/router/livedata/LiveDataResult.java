package ch.so.arp.rag.router.livedata;

/**
 * Outcome of the live data branch: either normalized text facts or a typed
 * error with a human readable detail.
 */
public record LiveDataResult(String text, LiveDataError error, String detail) {

    public static LiveDataResult success(String text) {
        return new LiveDataResult(text, null, null);
    }

    public static LiveDataResult failure(LiveDataError error, String detail) {
        return new LiveDataResult(null, error, detail);
    }

    public boolean isSuccess() {
        return error == null;
    }
}

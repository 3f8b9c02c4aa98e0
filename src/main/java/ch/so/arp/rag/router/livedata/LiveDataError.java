package ch.so.arp.rag.router.livedata;

public enum LiveDataError {

    NOT_FOUND("not_found"),
    UPSTREAM_UNAVAILABLE("upstream_unavailable"),
    MALFORMED_RESPONSE("malformed_response");

    private final String code;

    LiveDataError(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}

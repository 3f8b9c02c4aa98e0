package ch.so.arp.rag.router.support;

import java.time.Duration;

/**
 * Raised when a call to an external collaborator does not finish within the
 * time allotted to its pipeline stage.
 */
public class StageTimeoutException extends RuntimeException {

    private final String stage;
    private final Duration timeout;

    public StageTimeoutException(String stage, Duration timeout) {
        super("Stage '" + stage + "' did not complete within " + timeout.toMillis() + " ms");
        this.stage = stage;
        this.timeout = timeout;
    }

    public StageTimeoutException(String stage, Duration timeout, Throwable cause) {
        super("Stage '" + stage + "' was interrupted before completing", cause);
        this.stage = stage;
        this.timeout = timeout;
    }

    public String getStage() {
        return stage;
    }

    public Duration getTimeout() {
        return timeout;
    }
}

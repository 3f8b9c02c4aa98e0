package ch.so.arp.rag.router.support;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs blocking calls against external collaborators with an enforced upper
 * bound. The call is submitted to a worker pool and the caller waits for at
 * most the given timeout; on expiry the worker is interrupted and a
 * {@link StageTimeoutException} is raised.
 * <p>
 * Runtime exceptions thrown by the call are rethrown unchanged so that callers
 * can keep handling their typed failures.
 */
public class TimeLimitedExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(TimeLimitedExecutor.class);

    private final ExecutorService executorService;

    public TimeLimitedExecutor(ExecutorService executorService) {
        this.executorService = Objects.requireNonNull(executorService, "executorService");
    }

    public <T> T call(String stage, Duration timeout, Callable<T> action) {
        Objects.requireNonNull(action, "action");
        Future<T> future = executorService.submit(action);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            LOGGER.warn("Stage '{}' timed out after {} ms", stage, timeout.toMillis());
            throw new StageTimeoutException(stage, timeout);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new StageTimeoutException(stage, timeout, ex);
        } catch (CancellationException ex) {
            throw new StageTimeoutException(stage, timeout, ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Stage '" + stage + "' failed: " + cause.getMessage(), cause);
        }
    }

    public void run(String stage, Duration timeout, Runnable action) {
        call(stage, timeout, () -> {
            action.run();
            return null;
        });
    }
}

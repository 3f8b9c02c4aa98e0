package ch.so.arp.rag.router.livedata;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.router.support.StageTimeoutException;
import ch.so.arp.rag.router.support.TimeLimitedExecutor;

/**
 * Turns a query into a provider request and the provider's answer into plain
 * text facts. Every failure is reported as a {@link LiveDataResult} carrying
 * a {@link LiveDataError}; nothing is thrown to the caller.
 */
public class LiveDataBranch {

    private static final Logger LOGGER = LoggerFactory.getLogger(LiveDataBranch.class);

    private final LiveDataProvider provider;
    private final LocationExtractor locationExtractor;
    private final TimeLimitedExecutor timeLimitedExecutor;
    private final Duration timeout;

    public LiveDataBranch(LiveDataProvider provider, LocationExtractor locationExtractor,
            TimeLimitedExecutor timeLimitedExecutor, Duration timeout) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.locationExtractor = Objects.requireNonNull(locationExtractor, "locationExtractor");
        this.timeLimitedExecutor = Objects.requireNonNull(timeLimitedExecutor, "timeLimitedExecutor");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    public LiveDataResult fetchLive(String query) {
        Optional<String> location = locationExtractor.extract(query);
        if (location.isEmpty()) {
            return LiveDataResult.failure(LiveDataError.NOT_FOUND,
                    "Could not extract a location from the query. Please specify a location.");
        }
        LiveDataRequest request = LiveDataRequest.currentWeather(location.get());
        try {
            WeatherObservation observation = timeLimitedExecutor.call("live-data", timeout,
                    () -> provider.fetch(request));
            if (observation == null) {
                return LiveDataResult.failure(LiveDataError.MALFORMED_RESPONSE,
                        "Live data provider returned no observation for " + request.location());
            }
            return LiveDataResult.success(observation.formatAsText());
        } catch (LiveDataException ex) {
            LOGGER.warn("Live data request for '{}' failed ({}): {}", request.location(), ex.getError().code(),
                    ex.getMessage());
            return LiveDataResult.failure(ex.getError(), ex.getMessage());
        } catch (StageTimeoutException ex) {
            return LiveDataResult.failure(LiveDataError.UPSTREAM_UNAVAILABLE,
                    "Live data provider did not respond within " + timeout.toMillis() + " ms");
        } catch (RuntimeException ex) {
            LOGGER.error("Unexpected live data failure for '{}'", request.location(), ex);
            return LiveDataResult.failure(LiveDataError.UPSTREAM_UNAVAILABLE,
                    "Live data provider failed: " + ex.getMessage());
        }
    }
}

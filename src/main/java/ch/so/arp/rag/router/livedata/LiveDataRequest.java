package ch.so.arp.rag.router.livedata;

import java.util.Objects;

/**
 * Structured request derived from a query for the live data provider.
 */
public record LiveDataRequest(String location, String topic) {

    public static final String CURRENT_WEATHER = "current_weather";

    public LiveDataRequest {
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(topic, "topic");
    }

    public static LiveDataRequest currentWeather(String location) {
        return new LiveDataRequest(location, CURRENT_WEATHER);
    }
}

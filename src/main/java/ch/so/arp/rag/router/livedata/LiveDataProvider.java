package ch.so.arp.rag.router.livedata;

/**
 * Client of the external live data service.
 */
@FunctionalInterface
public interface LiveDataProvider {

    /**
     * @throws LiveDataException for unknown locations, unreachable upstream
     *                           services and unreadable payloads
     */
    WeatherObservation fetch(LiveDataRequest request);
}

package ch.so.arp.rag.router.livedata;

import java.util.List;
import java.util.Locale;

/**
 * Deterministic replacement for the weather service. Observations are derived
 * from the location name so that repeated queries yield identical facts.
 */
public class MockLiveDataProvider implements LiveDataProvider {

    private static final List<String> CONDITIONS = List.of(
            "clear sky", "few clouds", "scattered clouds", "light rain", "overcast clouds", "mist");

    @Override
    public WeatherObservation fetch(LiveDataRequest request) {
        int seed = Math.floorMod(request.location().toLowerCase(Locale.ROOT).hashCode(), 1_000_003);
        double temperature = (seed % 350) / 10.0d - 5.0d;
        return new WeatherObservation(
                request.location(),
                temperature,
                temperature - 1.5d,
                CONDITIONS.get(seed % CONDITIONS.size()),
                30 + seed % 60,
                (seed % 120) / 10.0d,
                990 + seed % 40,
                5 + seed % 6);
    }
}

package ch.so.arp.rag.router.livedata;

import java.util.Locale;

/**
 * Current conditions at a location as reported by the live data provider.
 * Temperatures in °C, wind speed in m/s, pressure in hPa, visibility in km.
 */
public record WeatherObservation(
        String location,
        double temperature,
        double feelsLike,
        String description,
        int humidity,
        double windSpeed,
        int pressure,
        int visibilityKm) {

    /**
     * Formats the observation as plain text facts for the synthesizer.
     */
    public String formatAsText() {
        return String.format(Locale.ROOT, """
                Current weather in %s:
                - Temperature: %.1f°C (feels like %.1f°C)
                - Conditions: %s
                - Humidity: %d%%
                - Wind speed: %.1f m/s
                - Pressure: %d hPa
                - Visibility: %d km""",
                location, temperature, feelsLike, capitalize(description), humidity, windSpeed, pressure,
                visibilityKm);
    }

    private static String capitalize(String value) {
        if (value == null || value.isEmpty()) {
            return "Unknown";
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}

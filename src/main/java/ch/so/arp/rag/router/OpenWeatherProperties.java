package ch.so.arp.rag.router;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the OpenWeatherMap live data provider.
 */
@ConfigurationProperties(prefix = "rag.router.openweather")
public class OpenWeatherProperties {

    private String apiKey;

    /**
     * Base URL of the current weather API.
     */
    private String baseUrl = "https://api.openweathermap.org/data/2.5";

    /**
     * Base URL of the geocoding API used to resolve location names.
     */
    private String geocodingUrl = "https://api.openweathermap.org/geo/1.0";

    /**
     * Connect and request timeout of the HTTP client.
     */
    private Duration timeout = Duration.ofSeconds(10);

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getGeocodingUrl() {
        return geocodingUrl;
    }

    public void setGeocodingUrl(String geocodingUrl) {
        this.geocodingUrl = geocodingUrl;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }
}

package ch.so.arp.rag.router.livedata;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.rag.router.OpenWeatherProperties;

/**
 * {@link LiveDataProvider} backed by OpenWeatherMap. A location name is first
 * resolved to coordinates through the geocoding API, then the current
 * conditions are fetched in metric units.
 */
public class OpenWeatherMapProvider implements LiveDataProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenWeatherMapProvider.class);

    private final OpenWeatherProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public OpenWeatherMapProvider(OpenWeatherProperties properties) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new IllegalArgumentException(
                    "Property 'rag.router.openweather.api-key' must be provided when mocks are disabled");
        }
        this.properties = properties;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getTimeout())
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public WeatherObservation fetch(LiveDataRequest request) {
        LOGGER.debug("Fetching {} for '{}'", request.topic(), request.location());
        JsonNode places = get(properties.getGeocodingUrl() + "/direct?q=" + encode(request.location())
                + "&limit=1&appid=" + encode(properties.getApiKey()));
        if (!places.isArray() || places.isEmpty()) {
            throw new LiveDataException(LiveDataError.NOT_FOUND, "Location '" + request.location() + "' not found");
        }
        JsonNode place = places.get(0);
        if (!place.path("lat").isNumber() || !place.path("lon").isNumber()) {
            throw new LiveDataException(LiveDataError.MALFORMED_RESPONSE, "Geocoding result lacks coordinates");
        }
        JsonNode weather = get(String.format(Locale.ROOT, "%s/weather?lat=%f&lon=%f&units=metric&appid=%s",
                properties.getBaseUrl(), place.get("lat").asDouble(), place.get("lon").asDouble(),
                encode(properties.getApiKey())));
        return parseObservation(request.location(), weather);
    }

    WeatherObservation parseObservation(String location, JsonNode weather) {
        JsonNode main = weather.path("main");
        JsonNode conditions = weather.path("weather").path(0);
        if (!main.path("temp").isNumber() || !main.path("feels_like").isNumber()
                || !conditions.path("description").isTextual()) {
            throw new LiveDataException(LiveDataError.MALFORMED_RESPONSE,
                    "Weather payload for '" + location + "' is incomplete");
        }
        return new WeatherObservation(
                location,
                main.get("temp").asDouble(),
                main.get("feels_like").asDouble(),
                conditions.get("description").asText(),
                main.path("humidity").asInt(),
                weather.path("wind").path("speed").asDouble(),
                main.path("pressure").asInt(),
                weather.path("visibility").asInt() / 1000);
    }

    private JsonNode get(String url) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(properties.getTimeout())
                .GET()
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException ex) {
            throw new LiveDataException(LiveDataError.UPSTREAM_UNAVAILABLE, "Weather service timed out", ex);
        } catch (IOException ex) {
            throw new LiveDataException(LiveDataError.UPSTREAM_UNAVAILABLE,
                    "Weather service unreachable: " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new LiveDataException(LiveDataError.UPSTREAM_UNAVAILABLE, "Weather request interrupted", ex);
        }

        int status = response.statusCode();
        if (status == 404) {
            throw new LiveDataException(LiveDataError.NOT_FOUND, "Weather service has no data for the location");
        }
        if (status / 100 != 2) {
            LOGGER.warn("Weather service answered with status {}", status);
            throw new LiveDataException(LiveDataError.UPSTREAM_UNAVAILABLE,
                    "Weather service answered with status " + status);
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException ex) {
            throw new LiveDataException(LiveDataError.MALFORMED_RESPONSE, "Weather service sent unreadable JSON", ex);
        }
    }

    private String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}

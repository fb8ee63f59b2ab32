package app.fuelfinder.engine.geo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import app.fuelfinder.engine.Config;
import app.fuelfinder.engine.NetworkException;
import app.fuelfinder.engine.NotFoundException;
import app.fuelfinder.engine.internal.HttpUtil;
import app.fuelfinder.engine.internal.Json;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * GeoResolver backed by an OpenStreetMap Nominatim compatible search endpoint. Takes the first match only.
 */
public final class NominatimGeoResolver implements GeoResolver {

    private static final Logger LOGGER = Logger.getLogger(NominatimGeoResolver.class.getName());

    private final HttpClient httpClient;
    private final String searchUrl;
    private final String userAgent;
    private final Duration timeout;

    public NominatimGeoResolver(HttpClient httpClient, String searchUrl, String userAgent, Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.searchUrl = Objects.requireNonNull(searchUrl, "searchUrl");
        this.userAgent = userAgent == null ? Config.DEFAULT_USER_AGENT : userAgent;
        this.timeout = timeout == null ? Config.DEFAULT_REQUEST_TIMEOUT : timeout;
    }

    public static NominatimGeoResolver fromConfig(Config config) {
        return new NominatimGeoResolver(
            config.getHttpClient(), config.getGeocodingUrl(), config.getUserAgent(), config.getRequestTimeout());
    }

    @Override
    public GeocodedPlace resolve(String placeName) throws NotFoundException, NetworkException {
        if (placeName == null || placeName.isBlank()) {
            throw new IllegalArgumentException("placeName is required");
        }
        String query = placeName.trim();

        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", query);
        params.put("format", "json");
        params.put("limit", "1");

        LOGGER.info(() -> String.format(Locale.ROOT, "[fuelfinder] geocoding \"%s\"", query));
        HttpResponse<InputStream> response;
        try {
            response = HttpUtil.get(httpClient, searchUrl, params, Map.of("User-Agent", userAgent), timeout);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new NetworkException("geocoding interrupted", ex);
        } catch (IOException ex) {
            throw new NetworkException("geocoding request: " + ex.getMessage(), ex);
        }

        try (InputStream bodyStream = response.body()) {
            if (!HttpUtil.isSuccess(response.statusCode())) {
                bodyStream.readAllBytes();
                int status = response.statusCode();
                LOGGER.warning(() -> String.format(Locale.ROOT, "[fuelfinder] geocoding returned HTTP %d", status));
                throw new NotFoundException(query, "City '" + query + "' not found.");
            }

            JsonNode root = Json.mapper().readTree(bodyStream);
            if (root == null || !root.isArray() || root.isEmpty()) {
                throw new NotFoundException(query, "City '" + query + "' not found.");
            }

            JsonNode first = root.get(0);
            Double lat = Json.number(first, "lat");
            Double lon = Json.number(first, "lon");
            if (lat == null || lon == null || !Coordinate.isValid(lat, lon)) {
                throw new NotFoundException(query, "City '" + query + "' has no usable coordinates.");
            }

            String displayName = Json.text(first, "display_name");
            GeocodedPlace place = new GeocodedPlace(query, new Coordinate(lat, lon), displayName == null ? query : displayName);
            LOGGER.info(() -> String.format(Locale.ROOT, "[fuelfinder] \"%s\" resolved to %.5f,%.5f",
                query, place.coordinate().latitude(), place.coordinate().longitude()));
            return place;
        } catch (JsonProcessingException ex) {
            throw new NotFoundException(query, "City '" + query + "' not found.");
        } catch (IOException ex) {
            throw new NetworkException("read geocoding response: " + ex.getMessage(), ex);
        }
    }
}

package app.fuelfinder.engine.amenity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import app.fuelfinder.engine.AuthException;
import app.fuelfinder.engine.Config;
import app.fuelfinder.engine.MissingCodeException;
import app.fuelfinder.engine.NetworkException;
import app.fuelfinder.engine.UpstreamException;
import app.fuelfinder.engine.auth.AmenityHeaders;
import app.fuelfinder.engine.internal.ApiErrorDecoder;
import app.fuelfinder.engine.internal.HttpUtil;
import app.fuelfinder.engine.internal.Json;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * AmenityDetailSource backed by the amenity detail API.
 */
public final class AmenityDetailFetcher implements AmenityDetailSource {

    private static final Logger LOGGER = Logger.getLogger(AmenityDetailFetcher.class.getName());

    static final String OFFLINE_MESSAGE = "Real-time system offline.";

    private final HttpClient httpClient;
    private final String detailUrl;
    private final AmenityHeaders headers;
    private final Duration timeout;

    public AmenityDetailFetcher(HttpClient httpClient, String detailUrl, AmenityHeaders headers, Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.detailUrl = Objects.requireNonNull(detailUrl, "detailUrl");
        this.headers = Objects.requireNonNull(headers, "headers");
        this.timeout = timeout == null ? Config.DEFAULT_REQUEST_TIMEOUT : timeout;
    }

    public static AmenityDetailFetcher fromConfig(Config config, AmenityHeaders headers) {
        return new AmenityDetailFetcher(config.getHttpClient(), config.getDetailUrl(), headers, config.getRequestTimeout());
    }

    @Override
    public AmenityDetail fetch(String stationId, String realtimeCode)
        throws MissingCodeException, AuthException, UpstreamException, NetworkException {
        if (realtimeCode == null || realtimeCode.isBlank()) {
            throw new MissingCodeException(stationId);
        }
        String lookupKey = LocationCodes.toDetailLookupKey(realtimeCode);
        Map<String, String> requestHeaders = headers.build();

        LOGGER.info(() -> String.format(Locale.ROOT, "[fuelfinder] fetching amenity detail for station %s (key %s)",
            stationId, lookupKey));
        HttpResponse<InputStream> response;
        try {
            response = HttpUtil.get(httpClient, detailUrl, Map.of("locationId", lookupKey), requestHeaders, timeout);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new NetworkException("amenity detail interrupted", ex);
        } catch (IOException ex) {
            throw new NetworkException("amenity detail request: " + ex.getMessage(), ex);
        }

        try (InputStream bodyStream = response.body()) {
            if (!HttpUtil.isSuccess(response.statusCode())) {
                throw ApiErrorDecoder.decode(LOGGER, "amenity detail", response.statusCode(), bodyStream,
                    OFFLINE_MESSAGE);
            }
            return shape(stationId, Json.mapper().readTree(bodyStream));
        } catch (JsonProcessingException ex) {
            throw new UpstreamException(OFFLINE_MESSAGE, ex);
        } catch (IOException ex) {
            throw new NetworkException("read amenity detail response: " + ex.getMessage(), ex);
        }
    }

    /**
     * Maps the {@code data} object of a detail response. Absent sections or fields become unknown counts.
     */
    static AmenityDetail shape(String stationId, JsonNode root) throws UpstreamException {
        if (root == null || !root.isObject()) {
            throw new UpstreamException(UpstreamException.MALFORMED_PAYLOAD, OFFLINE_MESSAGE);
        }
        JsonNode data = root.path("data");
        if (!data.isMissingNode() && !data.isNull() && !data.isObject()) {
            throw new UpstreamException(UpstreamException.MALFORMED_PAYLOAD, OFFLINE_MESSAGE);
        }

        JsonNode parking = data.path("parking");
        JsonNode reserved = data.path("reserve_it");
        JsonNode shower = data.path("shower");

        return new AmenityDetail(
            stationId,
            Json.text(data, "site"),
            new ParkingAvailability(
                AmenityCount.fromNullable(Json.number(parking, "total_spaces")),
                AmenityCount.fromNullable(Json.number(parking, "available_spaces")),
                AmenityCount.fromNullable(Json.number(reserved, "available_spaces"))
            ),
            new ShowerAvailability(AmenityCount.fromNullable(Json.number(shower, "available_showers")))
        );
    }
}

package app.fuelfinder.engine.search;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import app.fuelfinder.engine.AuthException;
import app.fuelfinder.engine.Config;
import app.fuelfinder.engine.NetworkException;
import app.fuelfinder.engine.UpstreamException;
import app.fuelfinder.engine.auth.AmenityHeaders;
import app.fuelfinder.engine.geo.Coordinate;
import app.fuelfinder.engine.geo.Distances;
import app.fuelfinder.engine.internal.ApiErrorDecoder;
import app.fuelfinder.engine.internal.HttpUtil;
import app.fuelfinder.engine.internal.Json;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.logging.Logger;

/**
 * Queries the amenity search API around a coordinate and turns the raw records into an ordered, truncated list of
 * {@link RankedStation}s.
 *
 * <h2>Ranking</h2>
 * <ul>
 *   <li>{@link RankingMode#NEAREST}: ascending distance.</li>
 *   <li>{@link RankingMode#AMENITY_PRIORITY}: real-time capable stations first, each group ascending distance.</li>
 * </ul>
 * The sort is stable, so equal keys keep upstream order, and the whole candidate set is sorted before the result is
 * cut to the configured limit. Candidates without usable coordinates get {@link Distances#SENTINEL_MILES} and sink
 * to the end of their group instead of failing the batch.
 */
public final class StationRanker {

    private static final Logger LOGGER = Logger.getLogger(StationRanker.class.getName());

    static final String AMENITIES_TYPE = "1";
    static final String UNAVAILABLE_MESSAGE = "External amenity search unavailable.";

    private static final Comparator<RankedStation> BY_DISTANCE =
        Comparator.comparing((RankedStation station) -> !station.distanceKnown())
            .thenComparingDouble(RankedStation::distanceMiles);
    private static final Comparator<RankedStation> BY_PRIORITY =
        Comparator.comparing((RankedStation station) -> !station.hasRealtimeCapability()).thenComparing(BY_DISTANCE);

    private final HttpClient httpClient;
    private final String searchUrl;
    private final AmenityHeaders headers;
    private final int limit;
    private final Duration timeout;

    public StationRanker(HttpClient httpClient, String searchUrl, AmenityHeaders headers, int limit, Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.searchUrl = Objects.requireNonNull(searchUrl, "searchUrl");
        this.headers = Objects.requireNonNull(headers, "headers");
        if (limit < 1 || limit > Config.MAX_RESULT_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + Config.MAX_RESULT_LIMIT);
        }
        this.limit = limit;
        this.timeout = timeout == null ? Config.DEFAULT_SEARCH_TIMEOUT : timeout;
    }

    public static StationRanker fromConfig(Config config, AmenityHeaders headers) {
        return new StationRanker(
            config.getHttpClient(), config.getSearchUrl(), headers, config.getResultLimit(), config.getSearchTimeout());
    }

    public int getLimit() {
        return limit;
    }

    /**
     * Searches around {@code center} and returns at most {@link #getLimit()} stations in ranking order.
     *
     * @throws AuthException when no credential or API key is available; no search request is sent.
     * @throws UpstreamException when the search API answers with a non-success status or an unreadable payload.
     * @throws NetworkException on transport failure or timeout.
     */
    public List<RankedStation> search(Coordinate center, int radiusMeters, RankingMode mode)
        throws AuthException, UpstreamException, NetworkException {
        Objects.requireNonNull(center, "center");
        Objects.requireNonNull(mode, "mode");
        if (radiusMeters <= 0) {
            throw new IllegalArgumentException("radiusMeters must be positive");
        }

        Map<String, String> requestHeaders = headers.build();

        Map<String, String> params = new LinkedHashMap<>();
        params.put("latitude", Double.toString(center.latitude()));
        params.put("longitude", Double.toString(center.longitude()));
        params.put("radius", Integer.toString(radiusMeters));
        params.put("amenitiesType", AMENITIES_TYPE);

        LOGGER.info(() -> String.format(Locale.ROOT, "[fuelfinder] searching stations around %.5f,%.5f (radius %dm, mode %s)",
            center.latitude(), center.longitude(), radiusMeters, mode));

        HttpResponse<InputStream> response;
        try {
            response = HttpUtil.get(httpClient, searchUrl, params, requestHeaders, timeout);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new NetworkException("amenity search interrupted", ex);
        } catch (IOException ex) {
            throw new NetworkException("amenity search request: " + ex.getMessage(), ex);
        }

        List<StationCandidate> candidates;
        try (InputStream bodyStream = response.body()) {
            if (!HttpUtil.isSuccess(response.statusCode())) {
                throw ApiErrorDecoder.decode(LOGGER, "amenity search", response.statusCode(), bodyStream,
                    UNAVAILABLE_MESSAGE);
            }
            candidates = readCandidates(Json.mapper().readTree(bodyStream));
        } catch (JsonProcessingException ex) {
            throw new UpstreamException(UNAVAILABLE_MESSAGE, ex);
        } catch (IOException ex) {
            throw new NetworkException("read amenity search response: " + ex.getMessage(), ex);
        }

        List<RankedStation> ranked = rank(candidates, center, mode, limit);
        LOGGER.info(() -> String.format(Locale.ROOT, "[fuelfinder] %d candidates, returning %d", candidates.size(),
            ranked.size()));
        return ranked;
    }

    private static List<StationCandidate> readCandidates(JsonNode root) throws UpstreamException {
        JsonNode items;
        if (root == null || root.isMissingNode() || root.isNull()) {
            return List.of();
        } else if (root.isArray()) {
            items = root;
        } else if (root.isObject()) {
            items = root.path("data");
            if (items.isMissingNode() || items.isNull()) {
                return List.of();
            }
            if (!items.isArray()) {
                throw new UpstreamException(UpstreamException.MALFORMED_PAYLOAD, UNAVAILABLE_MESSAGE);
            }
        } else {
            throw new UpstreamException(UpstreamException.MALFORMED_PAYLOAD, UNAVAILABLE_MESSAGE);
        }

        List<StationCandidate> candidates = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            if (!item.isObject()) {
                LOGGER.warning(() -> "[fuelfinder] skipping non-object search record");
                continue;
            }
            candidates.add(StationCandidate.fromJson(item));
        }
        return candidates;
    }

    /**
     * Normalises, orders and truncates candidates. The input order is the upstream order used for ties.
     */
    public static List<RankedStation> rank(List<StationCandidate> candidates, Coordinate center, RankingMode mode,
                                           int limit) {
        List<RankedStation> normalized = new ArrayList<>(candidates.size());
        for (StationCandidate candidate : candidates) {
            normalized.add(normalize(candidate, center, mode));
        }
        normalized.sort(mode == RankingMode.AMENITY_PRIORITY ? BY_PRIORITY : BY_DISTANCE);
        return List.copyOf(normalized.subList(0, Math.min(limit, normalized.size())));
    }

    static RankedStation normalize(StationCandidate candidate, Coordinate center, RankingMode mode) {
        Optional<Coordinate> position = Coordinate.parse(candidate.locationGeo());
        if (position.isEmpty() && candidate.locationGeo() != null) {
            LOGGER.warning(() -> String.format(Locale.ROOT,
                "[fuelfinder] station %s has unusable geo \"%s\"; ranking it last", candidate.stationId(),
                candidate.locationGeo()));
        }
        double distance = Distances.haversineMiles(center, position.orElse(null));

        boolean realtime = candidate.hasRealtimeCapability();
        NextStep nextStep;
        String note;
        String features = "";
        if (mode == RankingMode.AMENITY_PRIORITY) {
            if (realtime) {
                features = "Real-time Amenities (Parking/Food)";
                nextStep = NextStep.RECOMMENDED;
                note = String.format(Locale.ROOT, "**RECOMMENDED**: fetch amenity detail (location_id=%s, location_cd=\"%s\")",
                    candidate.stationId(), candidate.realtimeCode());
            } else {
                nextStep = NextStep.UNAVAILABLE;
                note = "No real-time amenities data available for this station.";
            }
        } else if (realtime) {
            features = "Real-time amenities available";
            nextStep = NextStep.OPTIONAL;
            note = "Optional: fetch amenity detail if the driver asks for specifics.";
        } else {
            nextStep = NextStep.NONE;
            note = "Basic fuel station.";
        }

        return new RankedStation(
            candidate.name(),
            distance,
            position.isPresent(),
            describeLocation(candidate),
            Financials.of(candidate.customerPrice(), candidate.savings()),
            realtime,
            candidate.stationId(),
            realtime ? candidate.realtimeCode().trim() : null,
            nextStep,
            note,
            features,
            position.map(StationRanker::mapsUrl).orElse(null)
        );
    }

    private static String describeLocation(StationCandidate candidate) {
        StringJoiner joiner = new StringJoiner(", ");
        if (candidate.city() != null) {
            joiner.add(candidate.city());
        }
        if (candidate.state() != null) {
            joiner.add(candidate.state());
        }
        return joiner.length() == 0 ? "Unknown location" : joiner.toString();
    }

    private static String mapsUrl(Coordinate coordinate) {
        return "https://www.google.com/maps/search/?api=1&query=" + coordinate.latitude() + "," + coordinate.longitude();
    }
}

package app.fuelfinder.engine;

import app.fuelfinder.engine.amenity.AmenityDetail;
import app.fuelfinder.engine.amenity.AmenityDetailFetcher;
import app.fuelfinder.engine.auth.AmenityHeaders;
import app.fuelfinder.engine.auth.CredentialBroker;
import app.fuelfinder.engine.auth.CredentialProvider;
import app.fuelfinder.engine.geo.Coordinate;
import app.fuelfinder.engine.geo.GeoResolver;
import app.fuelfinder.engine.geo.GeocodedPlace;
import app.fuelfinder.engine.geo.NominatimGeoResolver;
import app.fuelfinder.engine.memory.ConversationMemory;
import app.fuelfinder.engine.memory.FollowUpAnswer;
import app.fuelfinder.engine.memory.FollowUpClassifier;
import app.fuelfinder.engine.search.RankedStation;
import app.fuelfinder.engine.search.RankingMode;
import app.fuelfinder.engine.search.StationRanker;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * <p>
 * Entry point of the stop resolution engine. One instance per process is enough: it is thread-safe and holds the
 * two process-wide caches (the amenity API credential and the per-user conversation memory).
 * </p>
 *
 * <h2>Request flow</h2>
 * <ol>
 *   <li>An utterance classified as an amenity follow-up is answered from the remembered station. Geocoding and
 *       search are skipped.</li>
 *   <li>Otherwise a place name, when given, is geocoded into the search center; else the query coordinate is used.</li>
 *   <li>Stations are searched and ranked around the center. Without an explicit mode, amenity wording selects
 *       {@link RankingMode#AMENITY_PRIORITY}, anything else {@link RankingMode#NEAREST}.</li>
 *   <li>The ranked list is remembered for the user, so the next follow-up can refer to it.</li>
 * </ol>
 *
 * <p>
 * Failures surface once as a {@link FuelFinderException} subtype; nothing is retried. A failed request leaves the
 * caches as they were.
 * </p>
 */
public final class StopResolutionEngine implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(StopResolutionEngine.class.getName());

    private final Config config;
    private final CredentialProvider credentials;
    private final GeoResolver geoResolver;
    private final StationRanker ranker;
    private final AmenityDetailFetcher amenityFetcher;
    private final ConversationMemory memory;

    public StopResolutionEngine(Config config) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        this.credentials = CredentialBroker.fromConfig(this.config);
        AmenityHeaders headers = new AmenityHeaders(
            credentials, this.config.getAmenityApiKey(), this.config.getUserAgent(), this.config.getDeviceOs());
        this.geoResolver = NominatimGeoResolver.fromConfig(this.config);
        this.ranker = StationRanker.fromConfig(this.config, headers);
        this.amenityFetcher = AmenityDetailFetcher.fromConfig(this.config, headers);
        this.memory = new ConversationMemory(amenityFetcher, this.config.getClock(), this.config.getSessionTtl());
    }

    /**
     * Handles one driver request for {@code userId}.
     *
     * @throws IllegalArgumentException when the request is a new search without place name or coordinate.
     * @throws FuelFinderException when a collaborator fails; see the subtypes for the failure kinds.
     */
    public EngineReply handle(String userId, StopQuery query) throws FuelFinderException {
        Objects.requireNonNull(query, "query");
        String text = query.getText();

        if (memory.classifyFollowUp(text)) {
            boolean hasStation = memory.get(userId).currentStation().isPresent();
            if (hasStation || !query.hasLocation()) {
                LOGGER.info(() -> "[fuelfinder] follow-up for " + userId + " answered from memory");
                FollowUpAnswer answer = memory.resolveFollowUp(userId, text);
                return EngineReply.followUp(answer);
            }
        }

        Coordinate center = query.getCoordinate().orElse(null);
        String placeLabel = null;
        if (query.getPlaceName().isPresent()) {
            GeocodedPlace place = geoResolver.resolve(query.getPlaceName().get());
            center = place.coordinate();
            placeLabel = place.displayName();
        }
        if (center == null) {
            throw new IllegalArgumentException("a new search needs a place name or coordinates");
        }

        RankingMode mode = query.getMode().orElseGet(() ->
            FollowUpClassifier.mentionsAmenity(text) ? RankingMode.AMENITY_PRIORITY : RankingMode.NEAREST);
        int radius = query.getRadiusMeters().orElse(config.getDefaultRadiusMeters());

        List<RankedStation> stations = ranker.search(center, radius, mode);
        memory.remember(userId, stations, query.getPlaceName().orElse(null), center);

        Coordinate searched = center;
        LOGGER.info(() -> String.format(Locale.ROOT, "[fuelfinder] %d station(s) for %s around %.5f,%.5f",
            stations.size(), userId, searched.latitude(), searched.longitude()));
        return EngineReply.search(stations, mode, center, placeLabel);
    }

    public GeocodedPlace resolvePlace(String placeName) throws NotFoundException, NetworkException {
        return geoResolver.resolve(placeName);
    }

    public List<RankedStation> search(Coordinate center, int radiusMeters, RankingMode mode)
        throws AuthException, UpstreamException, NetworkException {
        return ranker.search(center, radiusMeters, mode);
    }

    public AmenityDetail amenities(String stationId, String realtimeCode)
        throws MissingCodeException, AuthException, UpstreamException, NetworkException {
        return amenityFetcher.fetch(stationId, realtimeCode);
    }

    public ConversationMemory memory() {
        return memory;
    }

    public CredentialProvider credentials() {
        return credentials;
    }

    public Config config() {
        return config;
    }

    /**
     * Closes the engine. The underlying {@link java.net.http.HttpClient} is shared and needs no shutdown.
     */
    @Override
    public void close() {
        // httpClient is managed externally; nothing to close.
    }
}

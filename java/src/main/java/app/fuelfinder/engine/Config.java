package app.fuelfinder.engine;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link StopResolutionEngine} instances.
 *
 * <p>
 * Credential settings are optional at build time. When one is missing the engine still starts; the first call that
 * needs a credential fails with {@link AuthException}.
 * </p>
 */
public final class Config {

    public static final String DEFAULT_SEARCH_URL = "https://apiconnectdev.rxo.com/Xpo.DriverMobile.Apiv2/Amenities";
    public static final String DEFAULT_DETAIL_URL = "https://apiconnectdev.rxo.com/Xpo.DriverMobile.Apiv2/taAmenitiesInfo";
    public static final String DEFAULT_GEOCODING_URL = "https://nominatim.openstreetmap.org/search";
    public static final String DEFAULT_GRANT_TYPE = "client_credentials";
    public static final String DEFAULT_USER_AGENT = "FuelFinder/4.0";
    public static final String DEFAULT_DEVICE_OS = "web";
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_SEARCH_TIMEOUT = Duration.ofSeconds(15);
    public static final Duration DEFAULT_TOKEN_SAFETY_MARGIN = Duration.ofSeconds(60);
    public static final Duration DEFAULT_SESSION_TTL = Duration.ofMinutes(30);
    public static final int DEFAULT_RADIUS_METERS = 321869;
    public static final int DEFAULT_RESULT_LIMIT = 1;
    public static final int MAX_RESULT_LIMIT = 5;

    private final String tokenUrl;
    private final String clientId;
    private final String clientSecret;
    private final String scope;
    private final String grantType;
    private final String tokenApiKey;
    private final String amenityApiKey;
    private final String searchUrl;
    private final String detailUrl;
    private final String geocodingUrl;
    private final String userAgent;
    private final String deviceOs;
    private final Duration requestTimeout;
    private final Duration searchTimeout;
    private final Duration tokenSafetyMargin;
    private final Duration sessionTtl;
    private final int defaultRadiusMeters;
    private final int resultLimit;
    private final HttpClient httpClient;
    private final Clock clock;

    private Config(Builder builder) {
        this.tokenUrl = builder.tokenUrl;
        this.clientId = builder.clientId;
        this.clientSecret = builder.clientSecret;
        this.scope = builder.scope;
        this.grantType = builder.grantType;
        this.tokenApiKey = builder.tokenApiKey;
        this.amenityApiKey = builder.amenityApiKey;
        this.searchUrl = builder.searchUrl;
        this.detailUrl = builder.detailUrl;
        this.geocodingUrl = builder.geocodingUrl;
        this.userAgent = builder.userAgent;
        this.deviceOs = builder.deviceOs;
        this.requestTimeout = builder.requestTimeout;
        this.searchTimeout = builder.searchTimeout;
        this.tokenSafetyMargin = builder.tokenSafetyMargin;
        this.sessionTtl = builder.sessionTtl;
        this.defaultRadiusMeters = builder.defaultRadiusMeters;
        this.resultLimit = builder.resultLimit;
        this.httpClient = builder.httpClient;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads settings from an environment-style map ({@code System.getenv()} in production). Absent keys fall back to
     * the documented defaults; absent credentials stay absent.
     */
    public static Config fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
            .tokenUrl(env.get("TOKEN_URL"))
            .clientId(env.get("TOKEN_CLIENT_ID"))
            .clientSecret(env.get("TOKEN_CLIENT_SECRET"))
            .scope(env.get("TOKEN_SCOPE"))
            .grantType(env.get("TOKEN_GRANT_TYPE"))
            .tokenApiKey(env.get("TOKEN_X_API_KEY"))
            .amenityApiKey(env.get("RXO_API_KEY"))
            .searchUrl(env.get("AMENITIES_API"))
            .detailUrl(env.get("AMENITIES_INFO_API"))
            .geocodingUrl(env.get("GEOCODING_API"))
            .build();
    }

    public Config withDefaults() {
        Duration resolvedTimeout = positiveOr(requestTimeout, DEFAULT_REQUEST_TIMEOUT);
        Duration resolvedSearchTimeout = positiveOr(searchTimeout, DEFAULT_SEARCH_TIMEOUT);

        Duration resolvedMargin = Optional.ofNullable(tokenSafetyMargin).orElse(DEFAULT_TOKEN_SAFETY_MARGIN);
        if (resolvedMargin.isNegative()) {
            throw new IllegalArgumentException("TokenSafetyMargin cannot be negative");
        }

        int resolvedRadius = defaultRadiusMeters > 0 ? defaultRadiusMeters : DEFAULT_RADIUS_METERS;
        int resolvedLimit = resultLimit <= 0 ? DEFAULT_RESULT_LIMIT : Math.min(resultLimit, MAX_RESULT_LIMIT);

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        Builder resolved = new Builder()
            .tokenUrl(tokenUrl == null ? null : sanitizeUrl(tokenUrl))
            .clientId(trimToNull(clientId))
            .clientSecret(trimToNull(clientSecret))
            .scope(trimToNull(scope))
            .grantType(Optional.ofNullable(trimToNull(grantType)).orElse(DEFAULT_GRANT_TYPE))
            .tokenApiKey(trimToNull(tokenApiKey))
            .amenityApiKey(trimToNull(amenityApiKey))
            .searchUrl(sanitizeUrl(Optional.ofNullable(trimToNull(searchUrl)).orElse(DEFAULT_SEARCH_URL)))
            .detailUrl(sanitizeUrl(Optional.ofNullable(trimToNull(detailUrl)).orElse(DEFAULT_DETAIL_URL)))
            .geocodingUrl(sanitizeUrl(Optional.ofNullable(trimToNull(geocodingUrl)).orElse(DEFAULT_GEOCODING_URL)))
            .userAgent(Optional.ofNullable(trimToNull(userAgent)).orElse(DEFAULT_USER_AGENT))
            .deviceOs(Optional.ofNullable(trimToNull(deviceOs)).orElse(DEFAULT_DEVICE_OS))
            .requestTimeout(resolvedTimeout)
            .searchTimeout(resolvedSearchTimeout)
            .tokenSafetyMargin(resolvedMargin)
            .sessionTtl(positiveOr(sessionTtl, DEFAULT_SESSION_TTL))
            .defaultRadiusMeters(resolvedRadius)
            .resultLimit(resolvedLimit)
            .httpClient(resolvedClient)
            .clock(Optional.ofNullable(clock).orElseGet(Clock::systemUTC));
        return resolved.buildInternal();
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        if (value == null || value.isNegative() || value.isZero()) {
            return fallback;
        }
        return value;
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host: " + trimmed);
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public String getTokenUrl() {
        return tokenUrl;
    }

    public String getClientId() {
        return clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public String getScope() {
        return scope;
    }

    public String getGrantType() {
        return grantType;
    }

    public String getTokenApiKey() {
        return tokenApiKey;
    }

    public String getAmenityApiKey() {
        return amenityApiKey;
    }

    public String getSearchUrl() {
        return searchUrl;
    }

    public String getDetailUrl() {
        return detailUrl;
    }

    public String getGeocodingUrl() {
        return geocodingUrl;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public String getDeviceOs() {
        return deviceOs;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public Duration getSearchTimeout() {
        return searchTimeout;
    }

    public Duration getTokenSafetyMargin() {
        return tokenSafetyMargin;
    }

    public Duration getSessionTtl() {
        return sessionTtl;
    }

    public int getDefaultRadiusMeters() {
        return defaultRadiusMeters;
    }

    public int getResultLimit() {
        return resultLimit;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Clock getClock() {
        return clock;
    }

    public static final class Builder {
        private String tokenUrl;
        private String clientId;
        private String clientSecret;
        private String scope;
        private String grantType;
        private String tokenApiKey;
        private String amenityApiKey;
        private String searchUrl;
        private String detailUrl;
        private String geocodingUrl;
        private String userAgent;
        private String deviceOs;
        private Duration requestTimeout;
        private Duration searchTimeout;
        private Duration tokenSafetyMargin;
        private Duration sessionTtl;
        private int defaultRadiusMeters;
        private int resultLimit;
        private HttpClient httpClient;
        private Clock clock;

        public Builder tokenUrl(String tokenUrl) {
            this.tokenUrl = tokenUrl;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder clientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
            return this;
        }

        public Builder scope(String scope) {
            this.scope = scope;
            return this;
        }

        public Builder grantType(String grantType) {
            this.grantType = grantType;
            return this;
        }

        public Builder tokenApiKey(String tokenApiKey) {
            this.tokenApiKey = tokenApiKey;
            return this;
        }

        public Builder amenityApiKey(String amenityApiKey) {
            this.amenityApiKey = amenityApiKey;
            return this;
        }

        public Builder searchUrl(String searchUrl) {
            this.searchUrl = searchUrl;
            return this;
        }

        public Builder detailUrl(String detailUrl) {
            this.detailUrl = detailUrl;
            return this;
        }

        public Builder geocodingUrl(String geocodingUrl) {
            this.geocodingUrl = geocodingUrl;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder deviceOs(String deviceOs) {
            this.deviceOs = deviceOs;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder searchTimeout(Duration searchTimeout) {
            this.searchTimeout = searchTimeout;
            return this;
        }

        public Builder tokenSafetyMargin(Duration tokenSafetyMargin) {
            this.tokenSafetyMargin = tokenSafetyMargin;
            return this;
        }

        public Builder sessionTtl(Duration sessionTtl) {
            this.sessionTtl = sessionTtl;
            return this;
        }

        public Builder defaultRadiusMeters(int defaultRadiusMeters) {
            this.defaultRadiusMeters = defaultRadiusMeters;
            return this;
        }

        public Builder resultLimit(int resultLimit) {
            this.resultLimit = resultLimit;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}

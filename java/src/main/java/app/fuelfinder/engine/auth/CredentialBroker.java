package app.fuelfinder.engine.auth;

import com.fasterxml.jackson.databind.JsonNode;
import app.fuelfinder.engine.AuthException;
import app.fuelfinder.engine.Config;
import app.fuelfinder.engine.internal.HttpUtil;
import app.fuelfinder.engine.internal.Json;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * CredentialProvider performing the client credentials exchange against the amenity token endpoint.
 *
 * <p>
 * One credential is cached per broker. It is reused while {@code now < expiresAt}, where {@code expiresAt} is the
 * issued lifetime minus the configured safety margin, capped at half the lifetime. Refreshes are single-flight: concurrent callers that find the
 * cache expired wait for the first refresh and share its result. A failed refresh leaves the previous (stale)
 * credential in place; it is never returned once expired.
 * </p>
 */
public final class CredentialBroker implements CredentialProvider {

    private static final Logger LOGGER = Logger.getLogger(CredentialBroker.class.getName());
    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;
    private static final long MIN_EXPIRES_IN_SECONDS = 60;
    private static final long MAX_EXPIRES_IN_SECONDS = Duration.ofDays(1).getSeconds();

    private final HttpClient httpClient;
    private final String tokenUrl;
    private final String clientId;
    private final String clientSecret;
    private final String scope;
    private final String grantType;
    private final String apiKey;
    private final Duration safetyMargin;
    private final Duration requestTimeout;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile Credential cached;

    public CredentialBroker(
        HttpClient httpClient,
        String tokenUrl,
        String clientId,
        String clientSecret,
        String scope,
        String grantType,
        String apiKey,
        Duration safetyMargin,
        Duration requestTimeout,
        Clock clock
    ) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.tokenUrl = tokenUrl;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.scope = scope;
        this.grantType = grantType == null || grantType.isBlank() ? Config.DEFAULT_GRANT_TYPE : grantType;
        this.apiKey = apiKey;
        this.safetyMargin = safetyMargin == null || safetyMargin.isNegative()
            ? Config.DEFAULT_TOKEN_SAFETY_MARGIN : safetyMargin;
        this.requestTimeout = requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()
            ? Config.DEFAULT_REQUEST_TIMEOUT : requestTimeout;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static CredentialBroker fromConfig(Config config) {
        return new CredentialBroker(
            config.getHttpClient(),
            config.getTokenUrl(),
            config.getClientId(),
            config.getClientSecret(),
            config.getScope(),
            config.getGrantType(),
            config.getTokenApiKey(),
            config.getTokenSafetyMargin(),
            config.getRequestTimeout(),
            config.getClock()
        );
    }

    @Override
    public Credential getCredential() throws AuthException {
        Credential current = cached;
        if (current != null && current.isValidAt(clock.instant())) {
            return current;
        }

        lock.lock();
        try {
            current = cached;
            if (current != null && current.isValidAt(clock.instant())) {
                return current;
            }

            Credential fresh = fetchCredential();
            cached = fresh;
            return fresh;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void invalidate() {
        cached = null;
    }

    @Override
    public Credential forceRefresh() throws AuthException {
        lock.lock();
        try {
            Credential fresh = fetchCredential();
            cached = fresh;
            return fresh;
        } finally {
            lock.unlock();
        }
    }

    private void requireConfigured() throws AuthException {
        if (isBlank(tokenUrl)) {
            throw new AuthException("token URL is not configured");
        }
        if (isBlank(clientId) || isBlank(clientSecret) || isBlank(scope)) {
            throw new AuthException("client id, client secret and scope must all be configured");
        }
        if (isBlank(apiKey)) {
            throw new AuthException("token API key is not configured");
        }
    }

    private Credential fetchCredential() throws AuthException {
        requireConfigured();

        Map<String, String> body = new LinkedHashMap<>();
        body.put("client_id", clientId);
        body.put("client_secret", clientSecret);
        body.put("scope", scope);
        body.put("grant_type", grantType);

        LOGGER.info(() -> "[fuelfinder] requesting amenity API token");
        HttpResponse<InputStream> response;
        try {
            response = HttpUtil.postJson(httpClient, tokenUrl, body, Map.of("x-api-key", apiKey), requestTimeout);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AuthException("request token interrupted", ex);
        } catch (IOException ex) {
            throw new AuthException("request token: " + ex.getMessage(), ex);
        }

        try (InputStream bodyStream = response.body()) {
            int status = response.statusCode();
            if (!HttpUtil.isSuccess(status)) {
                bodyStream.readAllBytes();
                LOGGER.warning(() -> String.format(Locale.ROOT, "[fuelfinder] token endpoint returned HTTP %d", status));
                throw new AuthException("token endpoint returned status " + status, status);
            }

            JsonNode node = Json.mapper().readTree(bodyStream);
            String accessToken = node == null ? null : Json.text(node, "access_token");
            if (accessToken == null) {
                throw new AuthException("token response missing access_token");
            }

            String tokenType = Json.text(node, "token_type");
            long expiresIn = lifetimeSeconds(Json.number(node, "expires_in"));
            Instant expiresAt = expiresAt(clock.instant(), expiresIn);

            LOGGER.info(() -> String.format(Locale.ROOT,
                "[fuelfinder] amenity API token issued (type=%s, expires_in=%ds)",
                tokenType == null ? "Bearer" : tokenType, expiresIn));
            return new Credential(accessToken, tokenType, expiresAt);
        } catch (IOException ex) {
            throw new AuthException("decode token response: " + ex.getMessage(), ex);
        }
    }

    /**
     * Missing lifetimes default to an hour; non-positive or absurd ones are clamped to [60 s, 1 day].
     */
    static long lifetimeSeconds(Double expiresIn) {
        if (expiresIn == null) {
            return DEFAULT_EXPIRES_IN_SECONDS;
        }
        if (expiresIn.isNaN() || expiresIn <= MIN_EXPIRES_IN_SECONDS) {
            return MIN_EXPIRES_IN_SECONDS;
        }
        return (long) Math.min(expiresIn, MAX_EXPIRES_IN_SECONDS);
    }

    /**
     * The margin never consumes more than half the lifetime, so a fresh credential is always valid when returned.
     */
    private Instant expiresAt(Instant now, long lifetimeSeconds) throws AuthException {
        Duration lifetime = Duration.ofSeconds(lifetimeSeconds);
        Duration margin = safetyMargin.compareTo(lifetime.dividedBy(2)) > 0 ? lifetime.dividedBy(2) : safetyMargin;
        try {
            return now.plus(lifetime).minus(margin);
        } catch (DateTimeException | ArithmeticException ex) {
            throw new AuthException("token lifetime out of range", ex);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

package app.fuelfinder.engine.auth;

import java.time.Instant;
import java.util.Objects;

/**
 * Bearer credential for the amenity APIs. {@code expiresAt} already includes the safety margin, so a credential is
 * usable for as long as {@link #isValidAt(Instant)} holds.
 */
public final class Credential {
    private final String token;
    private final String scheme;
    private final Instant expiresAt;

    public Credential(String token, String scheme, Instant expiresAt) {
        this.token = Objects.requireNonNull(token, "token");
        this.scheme = scheme == null || scheme.isBlank() ? "Bearer" : scheme;
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public String getToken() {
        return token;
    }

    public String getScheme() {
        return scheme;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public boolean isValidAt(Instant now) {
        return now.isBefore(expiresAt);
    }

    /**
     * @return value for the {@code authorization} header, for example {@code Bearer abc123}.
     */
    public String authorizationHeader() {
        return scheme + " " + token;
    }

    @Override
    public String toString() {
        return "Credential{scheme=" + scheme + ", expiresAt=" + expiresAt + "}";
    }
}

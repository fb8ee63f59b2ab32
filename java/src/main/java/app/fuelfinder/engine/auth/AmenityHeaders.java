package app.fuelfinder.engine.auth;

import app.fuelfinder.engine.AuthException;
import app.fuelfinder.engine.Config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the header set shared by the amenity search and amenity detail calls. Both the API key and a credential
 * are mandatory; without either the call fails closed.
 */
public final class AmenityHeaders {

    private final CredentialProvider credentials;
    private final String apiKey;
    private final String userAgent;
    private final String deviceOs;

    public AmenityHeaders(CredentialProvider credentials, String apiKey, String userAgent, String deviceOs) {
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.apiKey = apiKey;
        this.userAgent = userAgent == null ? Config.DEFAULT_USER_AGENT : userAgent;
        this.deviceOs = deviceOs == null ? Config.DEFAULT_DEVICE_OS : deviceOs;
    }

    public Map<String, String> build() throws AuthException {
        if (apiKey == null || apiKey.isBlank()) {
            throw new AuthException("amenity API key is not configured");
        }
        Credential credential = credentials.getCredential();

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("accept", "application/json");
        headers.put("user-agent", userAgent);
        headers.put("deviceos", deviceOs);
        headers.put("x-apikey", apiKey);
        headers.put("authorization", credential.authorizationHeader());
        return headers;
    }
}

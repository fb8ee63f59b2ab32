package app.fuelfinder.engine.auth;

import app.fuelfinder.engine.AuthException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AmenityHeadersTest {

    @Test
    void carriesApiKeyAndAuthorization() throws Exception {
        CredentialProvider provider = () -> new Credential("abc123", "Bearer", Instant.parse("2030-01-01T00:00:00Z"));
        AmenityHeaders headers = new AmenityHeaders(provider, "amenity-key", "FuelFinder/4.0", "web");

        Map<String, String> built = headers.build();

        assertEquals("application/json", built.get("accept"));
        assertEquals("FuelFinder/4.0", built.get("user-agent"));
        assertEquals("web", built.get("deviceos"));
        assertEquals("amenity-key", built.get("x-apikey"));
        assertEquals("Bearer abc123", built.get("authorization"));
    }

    @Test
    void failsClosedWithoutApiKeyBeforeAskingForCredential() {
        AtomicInteger credentialCalls = new AtomicInteger();
        CredentialProvider provider = () -> {
            credentialCalls.incrementAndGet();
            return new Credential("abc123", null, Instant.parse("2030-01-01T00:00:00Z"));
        };
        AmenityHeaders headers = new AmenityHeaders(provider, " ", null, null);

        assertThrows(AuthException.class, headers::build);
        assertEquals(0, credentialCalls.get());
    }

    @Test
    void propagatesCredentialFailure() {
        CredentialProvider provider = () -> {
            throw new AuthException("token endpoint returned status 500", 500);
        };
        AmenityHeaders headers = new AmenityHeaders(provider, "amenity-key", null, null);

        AuthException ex = assertThrows(AuthException.class, headers::build);
        assertEquals(500, ex.getStatusCode());
    }
}

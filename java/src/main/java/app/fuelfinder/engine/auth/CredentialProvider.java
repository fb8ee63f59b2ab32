package app.fuelfinder.engine.auth;

import app.fuelfinder.engine.AuthException;

/**
 * Contract for obtaining amenity API credentials.
 */
public interface CredentialProvider {

    Credential getCredential() throws AuthException;

    default void invalidate() {
        // default no-op
    }

    default Credential forceRefresh() throws AuthException {
        invalidate();
        return getCredential();
    }
}

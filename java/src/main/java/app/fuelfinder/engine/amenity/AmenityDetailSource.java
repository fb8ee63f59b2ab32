package app.fuelfinder.engine.amenity;

import app.fuelfinder.engine.AuthException;
import app.fuelfinder.engine.MissingCodeException;
import app.fuelfinder.engine.NetworkException;
import app.fuelfinder.engine.UpstreamException;

/**
 * Contract for fetching live amenity detail of one station.
 */
public interface AmenityDetailSource {

    AmenityDetail fetch(String stationId, String realtimeCode)
        throws MissingCodeException, AuthException, UpstreamException, NetworkException;
}

package app.fuelfinder.engine.geo;

import app.fuelfinder.engine.NetworkException;
import app.fuelfinder.engine.NotFoundException;

/**
 * Converts a place name into a coordinate. Implementations do not cache.
 */
public interface GeoResolver {

    GeocodedPlace resolve(String placeName) throws NotFoundException, NetworkException;
}

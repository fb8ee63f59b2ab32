package app.fuelfinder.engine.geo;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of a successful geocoding lookup.
 */
public record GeocodedPlace(
    String query,
    Coordinate coordinate,
    @JsonProperty("display_name") String displayName
) {
}

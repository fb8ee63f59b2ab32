package app.fuelfinder.engine.geo;

import java.util.Optional;

/**
 * Immutable WGS84 point.
 */
public record Coordinate(double latitude, double longitude) {

    public Coordinate {
        if (!isValid(latitude, longitude)) {
            throw new IllegalArgumentException("invalid coordinate " + latitude + "," + longitude);
        }
    }

    /**
     * Parses the upstream {@code "lat,lon"} form. Anything malformed, non-finite or out of range yields empty.
     */
    public static Optional<Coordinate> parse(String geo) {
        if (geo == null || !geo.contains(",")) {
            return Optional.empty();
        }
        String[] parts = geo.split(",");
        if (parts.length < 2) {
            return Optional.empty();
        }
        try {
            double lat = Double.parseDouble(parts[0].trim());
            double lon = Double.parseDouble(parts[1].trim());
            return isValid(lat, lon) ? Optional.of(new Coordinate(lat, lon)) : Optional.empty();
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    public static boolean isValid(double latitude, double longitude) {
        return Double.isFinite(latitude) && Double.isFinite(longitude)
            && latitude >= -90 && latitude <= 90
            && longitude >= -180 && longitude <= 180;
    }
}

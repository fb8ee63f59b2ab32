package app.fuelfinder.engine.geo;

/**
 * Great-circle distance in statute miles.
 */
public final class Distances {

    public static final double EARTH_RADIUS_MILES = 3958.8;

    /**
     * Distance reported when either end is unknown. Real distances can exceed it, so callers track whether a
     * distance is known separately.
     */
    public static final double SENTINEL_MILES = 9999.0;

    private Distances() {
    }

    /**
     * Haversine distance rounded to two decimals, or {@link #SENTINEL_MILES} when either point is missing.
     */
    public static double haversineMiles(Coordinate from, Coordinate to) {
        if (from == null || to == null) {
            return SENTINEL_MILES;
        }
        double dLat = Math.toRadians(to.latitude() - from.latitude());
        double dLon = Math.toRadians(to.longitude() - from.longitude());
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
            + Math.cos(Math.toRadians(from.latitude())) * Math.cos(Math.toRadians(to.latitude()))
            * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        double miles = EARTH_RADIUS_MILES * c;
        if (!Double.isFinite(miles)) {
            return SENTINEL_MILES;
        }
        return Math.round(miles * 100.0) / 100.0;
    }
}

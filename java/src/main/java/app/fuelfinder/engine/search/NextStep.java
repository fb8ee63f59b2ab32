package app.fuelfinder.engine.search;

/**
 * Machine-readable follow-up directive attached to every ranked station.
 */
public enum NextStep {
    /** Caller should fetch amenity detail for this station now. */
    RECOMMENDED,
    /** Amenity detail exists but is only worth fetching when the driver asks. */
    OPTIONAL,
    /** Amenities were requested but this station has no real-time data. */
    UNAVAILABLE,
    /** Plain fuel stop. */
    NONE
}

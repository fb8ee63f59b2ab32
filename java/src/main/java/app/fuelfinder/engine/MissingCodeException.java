package app.fuelfinder.engine;

/**
 * Amenity detail was requested for a station that has no real-time location code.
 */
public final class MissingCodeException extends FuelFinderException {

    private static final long serialVersionUID = 1L;

    private final String stationId;

    public MissingCodeException(String stationId) {
        super("station " + stationId + " has no real-time location code");
        this.stationId = stationId;
    }

    public String getStationId() {
        return stationId;
    }
}

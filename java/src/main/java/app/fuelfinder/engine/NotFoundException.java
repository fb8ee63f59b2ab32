package app.fuelfinder.engine;

/**
 * The geocoding provider had no match for a place name.
 */
public final class NotFoundException extends FuelFinderException {

    private static final long serialVersionUID = 1L;

    private final String query;

    public NotFoundException(String query, String message) {
        super(message);
        this.query = query;
    }

    public String getQuery() {
        return query;
    }
}

package app.fuelfinder.engine.amenity;

/**
 * Normalisation of the real-time location code before it is used as detail lookup key.
 *
 * <p>
 * The search API reports codes with a one character prefix that the detail API does not accept (a search code
 * {@code "T0123"} is looked up as {@code "0123"}). Codes of three characters or fewer are assumed to be bare and
 * are passed through. Leading and trailing whitespace is removed first.
 * </p>
 */
public final class LocationCodes {

    static final int BARE_CODE_MAX_LENGTH = 3;

    private LocationCodes() {
    }

    /**
     * @param realtimeCode code as reported by the search API; must not be blank.
     * @return the key to send as {@code locationId} to the detail API.
     */
    public static String toDetailLookupKey(String realtimeCode) {
        if (realtimeCode == null || realtimeCode.isBlank()) {
            throw new IllegalArgumentException("realtimeCode is required");
        }
        String code = realtimeCode.trim();
        return code.length() > BARE_CODE_MAX_LENGTH ? code.substring(1) : code;
    }
}

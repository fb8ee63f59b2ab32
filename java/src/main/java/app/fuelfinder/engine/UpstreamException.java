package app.fuelfinder.engine;

/**
 * Exception representing a failed call to an amenity API. Raised for non-success statuses and for payloads that
 * cannot be interpreted. The message is deliberately generic; upstream bodies are logged, never surfaced.
 */
public final class UpstreamException extends FuelFinderException {

    private static final long serialVersionUID = 1L;

    public static final int MALFORMED_PAYLOAD = -1;

    private final int statusCode;

    public UpstreamException(int statusCode, String message) {
        super(message == null || message.isBlank() ? defaultMessage(statusCode) : message);
        this.statusCode = statusCode;
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = MALFORMED_PAYLOAD;
    }

    /**
     * @return HTTP status returned by the upstream API, or {@link #MALFORMED_PAYLOAD} when the response was
     * unreadable.
     */
    public int getStatusCode() {
        return statusCode;
    }

    private static String defaultMessage(int status) {
        return "upstream request failed with status " + status;
    }
}

package app.fuelfinder.engine;

/**
 * Raised when no usable credential can be produced: configuration is incomplete, the token endpoint rejected the
 * request, or the token response carried no access token.
 */
public final class AuthException extends FuelFinderException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;

    public AuthException(String message) {
        this(message, -1, null);
    }

    public AuthException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public AuthException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    private AuthException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return HTTP status returned by the token endpoint, or {@code -1} when the failure happened before a response.
     */
    public int getStatusCode() {
        return statusCode;
    }
}

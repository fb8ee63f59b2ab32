package app.fuelfinder.engine;

/**
 * Transport level failure (connection refused, reset, timeout or interruption) while talking to an upstream service.
 */
public final class NetworkException extends FuelFinderException {

    private static final long serialVersionUID = 1L;

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}

package app.fuelfinder.engine;

/**
 * Base exception thrown by the stop resolution engine. Callers are expected to catch it and degrade to a
 * user-visible apology; every subtype describes one failure kind.
 */
public class FuelFinderException extends Exception {

    private static final long serialVersionUID = 1L;

    public FuelFinderException(String message) {
        super(message);
    }

    public FuelFinderException(String message, Throwable cause) {
        super(message, cause);
    }
}

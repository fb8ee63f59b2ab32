package app.fuelfinder.engine.internal;

import app.fuelfinder.engine.UpstreamException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns a non-success upstream response into an {@link UpstreamException}. The body is only logged (truncated, at
 * FINE) so that upstream error text never reaches the driver.
 */
public final class ApiErrorDecoder {

    private static final int MAX_LOGGED_BODY = 512;

    private ApiErrorDecoder() {
    }

    public static UpstreamException decode(Logger logger, String api, int statusCode, InputStream bodyStream,
                                           String message) {
        String body = readQuietly(bodyStream);
        logger.warning(() -> String.format(Locale.ROOT, "[fuelfinder] %s returned HTTP %d", api, statusCode));
        if (body != null && !body.isEmpty() && logger.isLoggable(Level.FINE)) {
            String snippet = body.length() > MAX_LOGGED_BODY ? body.substring(0, MAX_LOGGED_BODY) + "..." : body;
            logger.fine(() -> String.format(Locale.ROOT, "[fuelfinder] %s error body: %s", api, snippet));
        }
        return new UpstreamException(statusCode, message);
    }

    private static String readQuietly(InputStream bodyStream) {
        if (bodyStream == null) {
            return null;
        }
        try {
            return new String(bodyStream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            // the status already decides the outcome; the body is diagnostic only
            return "<unreadable body: " + ex.getMessage() + ">";
        }
    }
}

package app.fuelfinder.engine.geo;

import app.fuelfinder.engine.NetworkException;
import app.fuelfinder.engine.NotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class NominatimGeoResolverTest {

    private HttpServer server;
    private URI baseUri;
    private final AtomicInteger requests = new AtomicInteger();
    private final AtomicReference<String> lastQuery = new AtomicReference<>();
    private final AtomicReference<String> lastUserAgent = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.start();
        baseUri = URI.create("http://localhost:" + server.getAddress().getPort());
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void resolvesFirstMatch() throws Exception {
        serve(200, "[{\"lat\":\"41.8755616\",\"lon\":\"-87.6244212\",\"display_name\":\"Chicago, Cook County, Illinois\"},"
            + "{\"lat\":\"1\",\"lon\":\"1\",\"display_name\":\"Elsewhere\"}]");

        GeocodedPlace place = resolver().resolve("Chicago");

        assertEquals(41.8755616, place.coordinate().latitude());
        assertEquals(-87.6244212, place.coordinate().longitude());
        assertEquals("Chicago, Cook County, Illinois", place.displayName());
        assertTrue(lastQuery.get().contains("q=Chicago"));
        assertTrue(lastQuery.get().contains("format=json"));
        assertTrue(lastQuery.get().contains("limit=1"));
        assertEquals("FuelFinder/4.0", lastUserAgent.get());
    }

    @Test
    void doesNotCacheRepeatedLookups() throws Exception {
        serve(200, "[{\"lat\":41.8,\"lon\":-87.6,\"display_name\":\"Chicago\"}]");
        NominatimGeoResolver resolver = resolver();

        resolver.resolve("Chicago");
        resolver.resolve("Chicago");

        assertEquals(2, requests.get());
    }

    @Test
    void emptyResultIsNotFound() {
        serve(200, "[]");

        NotFoundException ex = assertThrows(NotFoundException.class, () -> resolver().resolve("Atlantis"));
        assertEquals("Atlantis", ex.getQuery());
    }

    @Test
    void nonSuccessStatusIsNotFound() {
        serve(503, "{\"error\":\"overloaded\"}");

        assertThrows(NotFoundException.class, () -> resolver().resolve("Chicago"));
    }

    @Test
    void transportFailureIsNetworkError() {
        NominatimGeoResolver resolver = resolver();
        server.stop(0);
        server = null;

        assertThrows(NetworkException.class, () -> resolver.resolve("Chicago"));
    }

    @Test
    void blankPlaceNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> resolver().resolve("  "));
    }

    private NominatimGeoResolver resolver() {
        return new NominatimGeoResolver(
            HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build(),
            baseUri.resolve("/search").toString(),
            "FuelFinder/4.0",
            Duration.ofSeconds(5)
        );
    }

    private void serve(int status, String body) {
        server.createContext("/search", exchange -> {
            requests.incrementAndGet();
            lastQuery.set(exchange.getRequestURI().getRawQuery());
            lastUserAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
            respond(exchange, status, body);
        });
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] payload = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
    }
}

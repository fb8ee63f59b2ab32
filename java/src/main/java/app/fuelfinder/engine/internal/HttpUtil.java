package app.fuelfinder.engine.internal;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Helper methods for issuing HTTP requests with JSON payloads and query strings.
 */
public final class HttpUtil {

    private HttpUtil() {
    }

    public static HttpResponse<InputStream> get(
        HttpClient client,
        String url,
        Map<String, String> query,
        Map<String, String> headers,
        Duration timeout
    ) throws IOException, InterruptedException {

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(withQuery(url, query)))
            .timeout(timeout)
            .GET();
        headers.forEach(builder::header);
        return client.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
    }

    public static HttpResponse<InputStream> postJson(
        HttpClient client,
        String url,
        Object payload,
        Map<String, String> headers,
        Duration timeout
    ) throws IOException, InterruptedException {

        byte[] body = Json.mapper().writeValueAsBytes(payload);
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(timeout)
            .POST(HttpRequest.BodyPublishers.ofByteArray(body))
            .header("Content-Type", "application/json");
        headers.forEach(builder::header);
        return client.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
    }

    /**
     * Appends URL-encoded query parameters, preserving their iteration order.
     */
    public static String withQuery(String url, Map<String, String> query) {
        if (query == null || query.isEmpty()) {
            return url;
        }
        StringJoiner joiner = new StringJoiner("&");
        query.forEach((key, value) -> joiner.add(
            URLEncoder.encode(key, StandardCharsets.UTF_8) + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8)));
        return url + (url.contains("?") ? "&" : "?") + joiner;
    }

    public static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }
}

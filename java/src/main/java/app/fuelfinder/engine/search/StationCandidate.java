package app.fuelfinder.engine.search;

import com.fasterxml.jackson.databind.JsonNode;
import app.fuelfinder.engine.internal.Json;

/**
 * Raw station record as returned by the amenity search API. Every field may be absent.
 */
public record StationCandidate(
    String name,
    String city,
    String state,
    String locationGeo,
    String stationId,
    String realtimeCode,
    Double customerPrice,
    Double savings
) {

    public static StationCandidate fromJson(JsonNode node) {
        return new StationCandidate(
            Json.text(node, "name"),
            Json.text(node, "city"),
            Json.text(node, "state"),
            Json.text(node, "locationGeo"),
            Json.text(node, "locationId"),
            Json.text(node, "locationCd"),
            Json.number(node, "customerPrice"),
            Json.number(node, "savings")
        );
    }

    public boolean hasRealtimeCapability() {
        return realtimeCode != null && !realtimeCode.isBlank();
    }
}

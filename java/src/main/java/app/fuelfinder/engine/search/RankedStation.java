package app.fuelfinder.engine.search;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import app.fuelfinder.engine.geo.Distances;

import java.util.Optional;

/**
 * Normalised station, ready for ranking and for the orchestration layer. {@code distanceMiles} is a non-negative
 * distance when {@code distanceKnown} holds, and {@link Distances#SENTINEL_MILES} otherwise.
 */
public record RankedStation(
    @JsonProperty("name") String name,
    @JsonProperty("distance_miles") double distanceMiles,
    @JsonProperty("distance_known") boolean distanceKnown,
    @JsonProperty("location") String location,
    @JsonProperty("financials") Financials financials,
    @JsonProperty("is_priority") boolean hasRealtimeCapability,
    @JsonProperty("location_id") String stationId,
    @JsonProperty("location_cd") String realtimeCode,
    @JsonProperty("next_step") NextStep nextStep,
    @JsonProperty("recommendation") String recommendationNote,
    @JsonProperty("features") String features,
    @JsonProperty("maps_url") String mapsUrl
) {

    @JsonIgnore
    public Optional<String> realtimeCodeIfPresent() {
        return Optional.ofNullable(realtimeCode).filter(code -> !code.isBlank());
    }

    /**
     * @return a display name, falling back to the location when upstream sent no name.
     */
    @JsonIgnore
    public String displayName() {
        if (name != null && !name.isBlank()) {
            return name;
        }
        return location == null || location.isBlank() ? "this station" : location;
    }
}

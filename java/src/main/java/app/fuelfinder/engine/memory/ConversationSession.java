package app.fuelfinder.engine.memory;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import app.fuelfinder.engine.geo.Coordinate;
import app.fuelfinder.engine.search.RankedStation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Snapshot of one user's short-term memory. Stations are kept in ranking order; the first one is the station
 * follow-ups refer to.
 */
public record ConversationSession(
    @JsonProperty("user_id") String userId,
    @JsonProperty("last_stations") List<RankedStation> lastStations,
    @JsonProperty("last_place") String lastPlaceName,
    @JsonProperty("last_coordinates") Coordinate lastCenter,
    @JsonProperty("updated_at") Instant updatedAt
) {

    public ConversationSession {
        lastStations = lastStations == null ? List.of() : List.copyOf(lastStations);
    }

    static ConversationSession empty(String userId, Instant now) {
        return new ConversationSession(userId, List.of(), null, null, now);
    }

    ConversationSession touchedAt(Instant now) {
        return new ConversationSession(userId, lastStations, lastPlaceName, lastCenter, now);
    }

    ConversationSession withResults(List<RankedStation> stations, String placeName, Coordinate center, Instant now) {
        return new ConversationSession(userId, stations, placeName, center, now);
    }

    @JsonIgnore
    public Optional<RankedStation> currentStation() {
        return lastStations.isEmpty() ? Optional.empty() : Optional.of(lastStations.get(0));
    }
}

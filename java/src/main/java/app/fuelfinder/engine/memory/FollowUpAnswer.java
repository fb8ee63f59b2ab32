package app.fuelfinder.engine.memory;

import com.fasterxml.jackson.annotation.JsonProperty;
import app.fuelfinder.engine.amenity.AmenityDetail;

import java.util.Set;

/**
 * Outcome of a follow-up question. {@code detail} is only present when the answer came from live data.
 */
public record FollowUpAnswer(
    @JsonProperty("status") Status status,
    @JsonProperty("topics") Set<AmenityTopic> topics,
    @JsonProperty("station") String stationName,
    @JsonProperty("text") String text,
    @JsonProperty("detail") AmenityDetail detail
) {

    public enum Status {
        ANSWERED,
        SEARCH_FIRST,
        UNAVAILABLE
    }

    static FollowUpAnswer searchFirst() {
        return new FollowUpAnswer(Status.SEARCH_FIRST, Set.of(), null,
            "I don't have a station in mind yet. Search for a stop first.", null);
    }
}

package app.fuelfinder.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import app.fuelfinder.engine.geo.Coordinate;
import app.fuelfinder.engine.memory.FollowUpAnswer;
import app.fuelfinder.engine.search.RankedStation;
import app.fuelfinder.engine.search.RankingMode;

import java.util.List;

/**
 * What {@link StopResolutionEngine#handle(String, StopQuery)} produced: either a fresh ranked result or an answer
 * about the remembered station.
 */
public record EngineReply(
    @JsonProperty("kind") Kind kind,
    @JsonProperty("stations") List<RankedStation> stations,
    @JsonProperty("mode") RankingMode mode,
    @JsonProperty("center") Coordinate center,
    @JsonProperty("place") String placeLabel,
    @JsonProperty("follow_up") FollowUpAnswer followUp
) {

    public enum Kind {
        SEARCH,
        FOLLOW_UP
    }

    public EngineReply {
        stations = stations == null ? List.of() : List.copyOf(stations);
    }

    static EngineReply search(List<RankedStation> stations, RankingMode mode, Coordinate center, String placeLabel) {
        return new EngineReply(Kind.SEARCH, stations, mode, center, placeLabel, null);
    }

    static EngineReply followUp(FollowUpAnswer answer) {
        return new EngineReply(Kind.FOLLOW_UP, List.of(), null, null, null, answer);
    }
}

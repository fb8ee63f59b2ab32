package app.fuelfinder.engine.memory;

import app.fuelfinder.engine.AuthException;
import app.fuelfinder.engine.Config;
import app.fuelfinder.engine.MissingCodeException;
import app.fuelfinder.engine.NetworkException;
import app.fuelfinder.engine.UpstreamException;
import app.fuelfinder.engine.amenity.AmenityCount;
import app.fuelfinder.engine.amenity.AmenityDetail;
import app.fuelfinder.engine.amenity.AmenityDetailSource;
import app.fuelfinder.engine.amenity.ParkingAvailability;
import app.fuelfinder.engine.geo.Coordinate;
import app.fuelfinder.engine.search.RankedStation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Per-user short-term memory of the last ranked result set, and the follow-up path that answers amenity questions
 * about the remembered station without a new search.
 *
 * <p>
 * Sessions are created lazily and refreshed on every access. A session idle for longer than the TTL is cleared on
 * its next access, before anything reads it. Expired sessions of users who never come back are evicted by a sweep
 * that runs at most once per TTL, piggybacking on regular access. Updates to one user are atomic per key; concurrent writers for the same
 * user resolve last-writer-wins. Nothing is persisted.
 * </p>
 */
public final class ConversationMemory {

    private static final Logger LOGGER = Logger.getLogger(ConversationMemory.class.getName());

    private final Map<String, ConversationSession> sessions = new ConcurrentHashMap<>();
    private final AmenityDetailSource amenities;
    private final Clock clock;
    private final Duration ttl;
    private volatile Instant lastSweep;

    public ConversationMemory(AmenityDetailSource amenities, Clock clock, Duration ttl) {
        this.amenities = Objects.requireNonNull(amenities, "amenities");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ttl = ttl == null || ttl.isZero() || ttl.isNegative() ? Config.DEFAULT_SESSION_TTL : ttl;
    }

    public Duration getTtl() {
        return ttl;
    }

    /**
     * Returns the user's session, creating it or clearing it after expiry, and marks it as used now.
     */
    public ConversationSession get(String userId) {
        String id = requireUserId(userId);
        Instant now = clock.instant();
        sweepIfDue(now);
        return sessions.compute(id, (key, existing) -> current(key, existing, now).touchedAt(now));
    }

    public void remember(String userId, List<RankedStation> stations) {
        remember(userId, stations, null, null);
    }

    /**
     * Replaces the remembered result set, together with the place and center the search ran for.
     */
    public void remember(String userId, List<RankedStation> stations, String placeName, Coordinate center) {
        String id = requireUserId(userId);
        List<RankedStation> copy = stations == null ? List.of() : List.copyOf(stations);
        Instant now = clock.instant();
        sweepIfDue(now);
        sessions.compute(id, (key, existing) -> current(key, existing, now).withResults(copy, placeName, center, now));
        LOGGER.fine(() -> String.format(Locale.ROOT, "[fuelfinder] remembered %d station(s) for %s", copy.size(), id));
    }

    /**
     * Drops the user's session.
     *
     * @return whether a session existed.
     */
    public boolean reset(String userId) {
        return sessions.remove(requireUserId(userId)) != null;
    }

    /**
     * Reads the session without creating or refreshing it. An expired session reads as absent and is removed.
     */
    public Optional<ConversationSession> snapshot(String userId) {
        String id = requireUserId(userId);
        Instant now = clock.instant();
        return Optional.ofNullable(
            sessions.computeIfPresent(id, (key, existing) -> isExpired(existing, now) ? null : existing));
    }

    /**
     * Removes every expired session.
     *
     * @return the number of sessions removed.
     */
    public int evictExpired() {
        return evictExpired(clock.instant());
    }

    public int size() {
        return sessions.size();
    }

    public boolean classifyFollowUp(String utterance) {
        return FollowUpClassifier.isFollowUp(utterance);
    }

    /**
     * Answers an amenity follow-up about the highest-ranked remembered station.
     *
     * @throws AuthException when amenity detail cannot be authorised.
     * @throws UpstreamException when the detail API fails; the message never carries upstream text.
     * @throws NetworkException on transport failure.
     */
    public FollowUpAnswer resolveFollowUp(String userId, String utterance)
        throws AuthException, UpstreamException, NetworkException {
        ConversationSession session = get(userId);
        Optional<RankedStation> current = session.currentStation();
        if (current.isEmpty()) {
            return FollowUpAnswer.searchFirst();
        }

        RankedStation station = current.get();
        Set<AmenityTopic> topics = FollowUpClassifier.requestedTopics(utterance);
        if (station.realtimeCodeIfPresent().isEmpty()) {
            return unavailable(station, topics);
        }

        AmenityDetail detail;
        try {
            detail = amenities.fetch(station.stationId(), station.realtimeCode());
        } catch (MissingCodeException ex) {
            return unavailable(station, topics);
        }
        return new FollowUpAnswer(FollowUpAnswer.Status.ANSWERED, topics, station.displayName(),
            compose(station.displayName(), topics, detail), detail);
    }

    private ConversationSession current(String userId, ConversationSession existing, Instant now) {
        if (existing == null) {
            LOGGER.fine(() -> "[fuelfinder] new session for " + userId);
            return ConversationSession.empty(userId, now);
        }
        if (isExpired(existing, now)) {
            LOGGER.info(() -> "[fuelfinder] session for " + userId + " expired; clearing remembered stations");
            return ConversationSession.empty(userId, now);
        }
        return existing;
    }

    private void sweepIfDue(Instant now) {
        Instant last = lastSweep;
        if (last != null && Duration.between(last, now).compareTo(ttl) <= 0) {
            return;
        }
        lastSweep = now;
        evictExpired(now);
    }

    private int evictExpired(Instant now) {
        int removed = 0;
        for (String key : sessions.keySet()) {
            if (sessions.computeIfPresent(key, (id, existing) -> isExpired(existing, now) ? null : existing) == null) {
                removed++;
            }
        }
        if (removed > 0) {
            int count = removed;
            LOGGER.fine(() -> String.format(Locale.ROOT, "[fuelfinder] evicted %d expired session(s)", count));
        }
        return removed;
    }

    private boolean isExpired(ConversationSession session, Instant now) {
        return Duration.between(session.updatedAt(), now).compareTo(ttl) > 0;
    }

    private static String requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        return userId;
    }

    private static FollowUpAnswer unavailable(RankedStation station, Set<AmenityTopic> topics) {
        return new FollowUpAnswer(FollowUpAnswer.Status.UNAVAILABLE, topics, station.displayName(),
            "Real-time amenities aren't available for " + station.displayName() + ".", null);
    }

    static String compose(String name, Set<AmenityTopic> topics, AmenityDetail detail) {
        StringJoiner answer = new StringJoiner(" ");
        for (AmenityTopic topic : AmenityTopic.values()) {
            if (!topics.contains(topic)) {
                continue;
            }
            switch (topic) {
                case PARKING:
                    answer.add(describeParking(name, detail.parking()));
                    break;
                case SHOWERS:
                    answer.add(detail.showers().available().isKnown()
                        ? name + " has " + plural(detail.showers().available(), "shower") + " available."
                        : "Shower availability at " + name + " is unknown right now.");
                    break;
                case FOOD:
                    answer.add(detail.food()
                        .map(food -> "Food at " + name + ": " + food + ".")
                        .orElse(name + " has no food info listed."));
                    break;
                default:
                    throw new IllegalStateException("unhandled topic " + topic);
            }
        }
        return answer.toString();
    }

    private static String describeParking(String name, ParkingAvailability parking) {
        StringBuilder text = new StringBuilder();
        if (parking.available().isKnown()) {
            text.append(name).append(" has ").append(plural(parking.available(), "parking spot")).append(" open");
            if (parking.total().isKnown()) {
                text.append(" out of ").append(parking.total());
            }
            text.append('.');
        } else {
            text.append("Parking availability at ").append(name).append(" is unknown right now.");
        }
        if (parking.reservedAvailable().isKnown()) {
            text.append(' ').append(plural(parking.reservedAvailable(), "reserved spot"))
                .append(parking.reservedAvailable().value().getAsInt() == 1 ? " is" : " are")
                .append(" available to book.");
        }
        return text.toString();
    }

    private static String plural(AmenityCount count, String noun) {
        int value = count.value().orElseThrow();
        return value + " " + noun + (value == 1 ? "" : "s");
    }
}

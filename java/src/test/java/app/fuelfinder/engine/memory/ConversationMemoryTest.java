package app.fuelfinder.engine.memory;

import com.fasterxml.jackson.databind.JsonNode;
import app.fuelfinder.engine.MutableClock;
import app.fuelfinder.engine.UpstreamException;
import app.fuelfinder.engine.amenity.AmenityCount;
import app.fuelfinder.engine.amenity.AmenityDetail;
import app.fuelfinder.engine.amenity.AmenityDetailSource;
import app.fuelfinder.engine.amenity.ParkingAvailability;
import app.fuelfinder.engine.amenity.ShowerAvailability;
import app.fuelfinder.engine.geo.Coordinate;
import app.fuelfinder.engine.internal.Json;
import app.fuelfinder.engine.search.Financials;
import app.fuelfinder.engine.search.NextStep;
import app.fuelfinder.engine.search.RankedStation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConversationMemoryTest {

    private static final AmenityDetail DETAIL = new AmenityDetail(
        "4711",
        "Burger King, Subway",
        new ParkingAvailability(AmenityCount.of(120), AmenityCount.of(18), AmenityCount.of(4)),
        new ShowerAvailability(AmenityCount.of(3))
    );

    private final MutableClock clock = MutableClock.startingAt("2026-01-05T08:00:00Z");
    private final List<String> fetches = new ArrayList<>();
    private AmenityDetail nextDetail;
    private ConversationMemory memory;

    @BeforeEach
    void setUp() {
        nextDetail = DETAIL;
        AmenityDetailSource source = (stationId, code) -> {
            fetches.add(stationId + "/" + code);
            return nextDetail;
        };
        memory = new ConversationMemory(source, clock, Duration.ofMinutes(30));
    }

    @Test
    void createsEmptySessionLazily() {
        ConversationSession session = memory.get("driver-1");

        assertEquals("driver-1", session.userId());
        assertTrue(session.lastStations().isEmpty());
        assertEquals(clock.instant(), session.updatedAt());
    }

    @Test
    void rememberOverwritesPreviousStations() {
        memory.remember("driver-1", List.of(station("Old Stop", "T0001")));
        memory.remember("driver-1", List.of(station("New Stop", "T0002"), station("Second", null)));

        ConversationSession session = memory.get("driver-1");
        assertEquals("New Stop", session.currentStation().orElseThrow().name());
        assertEquals(2, session.lastStations().size());
    }

    @Test
    void accessRefreshesUpdatedAt() {
        memory.remember("driver-1", List.of(station("Stop", "T0001")));

        clock.advance(Duration.ofMinutes(20));
        memory.get("driver-1");
        clock.advance(Duration.ofMinutes(20));

        ConversationSession session = memory.get("driver-1");
        assertFalse(session.lastStations().isEmpty());
        assertEquals(clock.instant(), session.updatedAt());
    }

    @Test
    void idleSessionIsClearedBeforeUse() {
        memory.remember("driver-1", List.of(station("Stop", "T0001")), "Chicago", new Coordinate(41.88, -87.63));

        clock.advance(Duration.ofMinutes(31));
        ConversationSession session = memory.get("driver-1");

        assertTrue(session.lastStations().isEmpty());
        assertNull(session.lastPlaceName());
        assertNull(session.lastCenter());
        assertEquals(clock.instant(), session.updatedAt());
    }

    @Test
    void sessionExactlyAtTtlSurvives() {
        memory.remember("driver-1", List.of(station("Stop", "T0001")));

        clock.advance(Duration.ofMinutes(30));

        assertFalse(memory.get("driver-1").lastStations().isEmpty());
    }

    @Test
    void expiredSessionCannotAnswerFollowUps() throws Exception {
        memory.remember("driver-1", List.of(station("Stop", "T0001")));
        clock.advance(Duration.ofHours(1));

        FollowUpAnswer answer = memory.resolveFollowUp("driver-1", "is there parking?");

        assertEquals(FollowUpAnswer.Status.SEARCH_FIRST, answer.status());
        assertTrue(fetches.isEmpty());
    }

    @Test
    void expiredSessionsOfAbsentUsersAreEvicted() {
        memory.remember("driver-1", List.of(station("Stop", "T0001")));
        memory.remember("driver-2", List.of(station("Stop", "T0002")));
        assertEquals(2, memory.size());

        clock.advance(Duration.ofMinutes(31));
        memory.get("driver-3");

        assertEquals(1, memory.size());
        assertTrue(memory.snapshot("driver-1").isEmpty());
    }

    @Test
    void snapshotRemovesExpiredSession() {
        memory.remember("driver-1", List.of(station("Stop", "T0001")));
        clock.advance(Duration.ofMinutes(45));

        assertTrue(memory.snapshot("driver-1").isEmpty());
        assertEquals(0, memory.size());
    }

    @Test
    void evictExpiredKeepsLiveSessions() {
        memory.remember("driver-1", List.of(station("Stop", "T0001")));
        clock.advance(Duration.ofMinutes(20));
        memory.remember("driver-2", List.of(station("Stop", "T0002")));
        clock.advance(Duration.ofMinutes(15));

        assertEquals(1, memory.evictExpired());
        assertEquals(0, memory.evictExpired());
        assertTrue(memory.snapshot("driver-2").isPresent());
    }

    @Test
    void sessionsAreIsolatedPerUser() {
        memory.remember("driver-1", List.of(station("Stop", "T0001")));

        assertTrue(memory.get("driver-2").lastStations().isEmpty());
    }

    @Test
    void resetDropsSession() {
        memory.remember("driver-1", List.of(station("Stop", "T0001")));

        assertTrue(memory.reset("driver-1"));
        assertFalse(memory.reset("driver-1"));
        assertTrue(memory.snapshot("driver-1").isEmpty());
    }

    @Test
    void snapshotDoesNotRefreshOrResurrect() {
        memory.remember("driver-1", List.of(station("Stop", "T0001")));
        clock.advance(Duration.ofMinutes(10));

        assertEquals(clock.instant().minus(Duration.ofMinutes(10)),
            memory.snapshot("driver-1").orElseThrow().updatedAt());

        clock.advance(Duration.ofMinutes(25));
        assertTrue(memory.snapshot("driver-1").isEmpty());
        assertTrue(memory.snapshot("nobody").isEmpty());
    }

    @Test
    void followUpWithoutSearchAsksToSearchFirst() throws Exception {
        FollowUpAnswer answer = memory.resolveFollowUp("driver-1", "is there parking?");

        assertEquals(FollowUpAnswer.Status.SEARCH_FIRST, answer.status());
        assertTrue(fetches.isEmpty());
    }

    @Test
    void stationWithoutCodeReportsUnavailable() throws Exception {
        memory.remember("driver-1", List.of(station("Plain Stop", null), station("Realtime", "T0002")));

        FollowUpAnswer answer = memory.resolveFollowUp("driver-1", "any showers?");

        assertEquals(FollowUpAnswer.Status.UNAVAILABLE, answer.status());
        assertEquals("Plain Stop", answer.stationName());
        assertTrue(answer.text().contains("Plain Stop"));
        assertTrue(fetches.isEmpty());
    }

    @Test
    void showerQuestionAnswersShowersOnly() throws Exception {
        memory.remember("driver-1", List.of(station("ORD 6", "T0471")));

        FollowUpAnswer answer = memory.resolveFollowUp("driver-1", "does it have showers?");

        assertEquals(FollowUpAnswer.Status.ANSWERED, answer.status());
        assertEquals(Set.of(AmenityTopic.SHOWERS), answer.topics());
        assertEquals("ORD 6 has 3 showers available.", answer.text());
        assertEquals(List.of("4711/T0471"), fetches);
    }

    @Test
    void foodQuestionAnswersFoodOnly() throws Exception {
        memory.remember("driver-1", List.of(station("ORD 6", "T0471")));

        FollowUpAnswer answer = memory.resolveFollowUp("driver-1", "any food?");

        assertEquals("Food at ORD 6: Burger King, Subway.", answer.text());
    }

    @Test
    void parkingQuestionAnswersParkingOnly() throws Exception {
        memory.remember("driver-1", List.of(station("ORD 6", "T0471")));

        FollowUpAnswer answer = memory.resolveFollowUp("driver-1", "can I park there?");

        assertEquals("ORD 6 has 18 parking spots open out of 120. 4 reserved spots are available to book.",
            answer.text());
    }

    @Test
    void genericQuestionAnswersAllTopics() throws Exception {
        memory.remember("driver-1", List.of(station("ORD 6", "T0471")));

        FollowUpAnswer answer = memory.resolveFollowUp("driver-1", "what amenities are there?");

        assertEquals(Set.of(AmenityTopic.PARKING, AmenityTopic.SHOWERS, AmenityTopic.FOOD), answer.topics());
        assertTrue(answer.text().contains("parking spots"));
        assertTrue(answer.text().contains("showers"));
        assertTrue(answer.text().contains("Burger King"));
        assertSame(DETAIL, answer.detail());
    }

    @Test
    void unknownCountsAreNeverReportedAsZero() throws Exception {
        nextDetail = new AmenityDetail("4711", null,
            new ParkingAvailability(AmenityCount.unknown(), AmenityCount.unknown(), AmenityCount.unknown()),
            new ShowerAvailability(AmenityCount.unknown()));
        memory.remember("driver-1", List.of(station("ORD 6", "T0471")));

        FollowUpAnswer answer = memory.resolveFollowUp("driver-1", "amenities?");

        assertFalse(answer.text().contains("0"));
        assertTrue(answer.text().contains("Parking availability at ORD 6 is unknown"));
        assertTrue(answer.text().contains("Shower availability at ORD 6 is unknown"));
        assertTrue(answer.text().contains("no food info"));
    }

    @Test
    void upstreamFailurePropagatesAndKeepsSession() {
        AmenityDetailSource failing = (stationId, code) -> {
            throw new UpstreamException(503, "Real-time system offline.");
        };
        ConversationMemory failingMemory = new ConversationMemory(failing, clock, Duration.ofMinutes(30));
        failingMemory.remember("driver-1", List.of(station("ORD 6", "T0471")));

        assertThrows(UpstreamException.class, () -> failingMemory.resolveFollowUp("driver-1", "showers?"));
        assertFalse(failingMemory.get("driver-1").lastStations().isEmpty());
    }

    @Test
    void rejectsBlankUserId() {
        assertThrows(IllegalArgumentException.class, () -> memory.get(" "));
        assertThrows(IllegalArgumentException.class, () -> memory.remember(null, List.of()));
    }

    @Test
    void serialisesSessionSnapshot() {
        memory.remember("driver-1", List.of(station("ORD 6", "T0471")), "Chicago", new Coordinate(41.88, -87.63));

        JsonNode json = Json.mapper().valueToTree(memory.get("driver-1"));

        assertEquals("driver-1", json.path("user_id").asText());
        assertEquals("Chicago", json.path("last_place").asText());
        assertEquals("2026-01-05T08:00:00Z", json.path("updated_at").asText());
        assertEquals("ORD 6", json.path("last_stations").get(0).path("name").asText());
    }

    private static RankedStation station(String name, String code) {
        boolean realtime = code != null;
        return new RankedStation(name, 4.2, true, "Chicago, IL", new Financials("$3.90", "$0.35"), realtime, "4711", code,
            realtime ? NextStep.OPTIONAL : NextStep.NONE, "", "", null);
    }
}

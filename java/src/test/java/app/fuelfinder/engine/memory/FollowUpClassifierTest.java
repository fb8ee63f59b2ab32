package app.fuelfinder.engine.memory;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FollowUpClassifierTest {

    @Test
    void amenityQuestionWithoutSearchVerbIsFollowUp() {
        assertTrue(FollowUpClassifier.isFollowUp("is there parking?"));
        assertTrue(FollowUpClassifier.isFollowUp("Does it have showers?"));
        assertTrue(FollowUpClassifier.isFollowUp("what about FOOD"));
        assertTrue(FollowUpClassifier.isFollowUp("any amenities there"));
    }

    @Test
    void searchVerbMakesItANewSearch() {
        assertFalse(FollowUpClassifier.isFollowUp("find a station with parking"));
        assertFalse(FollowUpClassifier.isFollowUp("where can I park tonight"));
        assertFalse(FollowUpClassifier.isFollowUp("show me showers near Dallas"));
    }

    @Test
    void noAmenityKeywordIsNotFollowUp() {
        assertFalse(FollowUpClassifier.isFollowUp("cheapest diesel"));
        assertFalse(FollowUpClassifier.isFollowUp(""));
        assertFalse(FollowUpClassifier.isFollowUp(null));
    }

    @Test
    void matchesWholeWordsOnly() {
        // "showers" must not be read as the verb "show", nor "parked" as "park"
        assertTrue(FollowUpClassifier.isFollowUp("showers?"));
        assertFalse(FollowUpClassifier.isFollowUp("I parked already"));
        assertFalse(FollowUpClassifier.isFollowUp("seafood prices"));
    }

    @Test
    void singleTopicIsAnsweredAlone() {
        assertEquals(Set.of(AmenityTopic.FOOD), FollowUpClassifier.requestedTopics("any food?"));
        assertEquals(Set.of(AmenityTopic.SHOWERS), FollowUpClassifier.requestedTopics("does it have showers?"));
        assertEquals(Set.of(AmenityTopic.PARKING), FollowUpClassifier.requestedTopics("can I park there"));
    }

    @Test
    void genericOrMixedQuestionsGetEveryTopic() {
        Set<AmenityTopic> all = EnumSet.allOf(AmenityTopic.class);
        assertEquals(all, FollowUpClassifier.requestedTopics("what amenities are there?"));
        assertEquals(all, FollowUpClassifier.requestedTopics("parking and food?"));
    }
}

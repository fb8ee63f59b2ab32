package app.fuelfinder.engine.memory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Keyword rules deciding whether an utterance is a follow-up about the current station or a new search.
 *
 * <p>
 * Matching is done on whole lower-cased words, so {@code "showers"} never counts as the search verb {@code "show"}.
 * An utterance is a follow-up only when it names an amenity and contains no search verb: "is there parking?" is a
 * follow-up, "find a station with parking" is a new search.
 * </p>
 */
public final class FollowUpClassifier {

    static final Set<String> AMENITY_WORDS =
        Set.of("parking", "park", "shower", "showers", "food", "amenities", "amenity");
    static final Set<String> SEARCH_WORDS =
        Set.of("find", "search", "look", "get", "show", "where", "which", "locate");

    private FollowUpClassifier() {
    }

    public static boolean isFollowUp(String utterance) {
        Set<String> words = words(utterance);
        return containsAny(words, AMENITY_WORDS) && !containsAny(words, SEARCH_WORDS);
    }

    /**
     * @return whether the utterance names any amenity at all, regardless of search verbs.
     */
    public static boolean mentionsAmenity(String utterance) {
        return containsAny(words(utterance), AMENITY_WORDS);
    }

    /**
     * Topics to answer for a follow-up: the single category named, or every category when the utterance names none
     * or several.
     */
    public static Set<AmenityTopic> requestedTopics(String utterance) {
        Set<String> words = words(utterance);
        EnumSet<AmenityTopic> mentioned = EnumSet.noneOf(AmenityTopic.class);
        if (words.contains("parking") || words.contains("park")) {
            mentioned.add(AmenityTopic.PARKING);
        }
        if (words.contains("shower") || words.contains("showers")) {
            mentioned.add(AmenityTopic.SHOWERS);
        }
        if (words.contains("food")) {
            mentioned.add(AmenityTopic.FOOD);
        }
        if (mentioned.size() != 1) {
            return Collections.unmodifiableSet(EnumSet.allOf(AmenityTopic.class));
        }
        return Collections.unmodifiableSet(mentioned);
    }

    static Set<String> words(String utterance) {
        if (utterance == null || utterance.isBlank()) {
            return Set.of();
        }
        Set<String> words = new HashSet<>();
        for (String word : utterance.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{Nd}]+")) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }

    private static boolean containsAny(Set<String> words, Set<String> keywords) {
        for (String keyword : keywords) {
            if (words.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}

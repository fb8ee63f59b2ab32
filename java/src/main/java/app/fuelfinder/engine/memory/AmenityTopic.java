package app.fuelfinder.engine.memory;

/**
 * Amenity categories a follow-up can ask about. Declaration order is answer order.
 */
public enum AmenityTopic {
    PARKING,
    SHOWERS,
    FOOD
}

package app.fuelfinder.engine.search;

/**
 * How candidates are ordered.
 */
public enum RankingMode {
    /** Pure distance, nearest first. */
    NEAREST,
    /** Real-time capable stations first, each group nearest first. */
    AMENITY_PRIORITY
}

package app.fuelfinder.engine;

import app.fuelfinder.engine.geo.Coordinate;
import app.fuelfinder.engine.search.RankingMode;

import java.util.Optional;

/**
 * One driver request as handed over by the orchestration layer. A new search needs a place name or a coordinate;
 * a follow-up only needs the text.
 */
public final class StopQuery {

    private final String text;
    private final String placeName;
    private final Coordinate coordinate;
    private final RankingMode mode;
    private final Integer radiusMeters;

    private StopQuery(Builder builder) {
        this.text = builder.text == null ? "" : builder.text.trim();
        this.placeName = builder.placeName == null || builder.placeName.isBlank() ? null : builder.placeName.trim();
        this.coordinate = builder.coordinate;
        this.mode = builder.mode;
        this.radiusMeters = builder.radiusMeters;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static StopQuery text(String text) {
        return builder().text(text).build();
    }

    public String getText() {
        return text;
    }

    public Optional<String> getPlaceName() {
        return Optional.ofNullable(placeName);
    }

    public Optional<Coordinate> getCoordinate() {
        return Optional.ofNullable(coordinate);
    }

    public Optional<RankingMode> getMode() {
        return Optional.ofNullable(mode);
    }

    public Optional<Integer> getRadiusMeters() {
        return Optional.ofNullable(radiusMeters);
    }

    public boolean hasLocation() {
        return placeName != null || coordinate != null;
    }

    public static final class Builder {
        private String text;
        private String placeName;
        private Coordinate coordinate;
        private RankingMode mode;
        private Integer radiusMeters;

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder placeName(String placeName) {
            this.placeName = placeName;
            return this;
        }

        public Builder coordinate(Coordinate coordinate) {
            this.coordinate = coordinate;
            return this;
        }

        public Builder coordinate(double latitude, double longitude) {
            this.coordinate = new Coordinate(latitude, longitude);
            return this;
        }

        public Builder mode(RankingMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder radiusMeters(int radiusMeters) {
            if (radiusMeters <= 0) {
                throw new IllegalArgumentException("radiusMeters must be positive");
            }
            this.radiusMeters = radiusMeters;
            return this;
        }

        public StopQuery build() {
            return new StopQuery(this);
        }
    }
}

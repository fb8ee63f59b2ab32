package app.fuelfinder.engine.amenity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * Real-time amenity state of one station. A {@code null} food description means upstream listed none.
 */
public record AmenityDetail(
    @JsonProperty("location_id") String stationId,
    @JsonProperty("food_options") String foodOptions,
    @JsonProperty("parking") ParkingAvailability parking,
    @JsonProperty("showers") ShowerAvailability showers
) {

    @JsonIgnore
    public Optional<String> food() {
        return Optional.ofNullable(foodOptions).filter(text -> !text.isBlank());
    }
}

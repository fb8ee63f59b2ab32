package app.fuelfinder.engine.amenity;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ParkingAvailability(
    @JsonProperty("total") AmenityCount total,
    @JsonProperty("available") AmenityCount available,
    @JsonProperty("reserved_available") AmenityCount reservedAvailable
) {
}

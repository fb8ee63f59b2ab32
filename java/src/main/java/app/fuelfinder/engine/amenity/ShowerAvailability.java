package app.fuelfinder.engine.amenity;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ShowerAvailability(@JsonProperty("available") AmenityCount available) {
}

package app.fuelfinder.engine.search;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

public record Financials(
    @JsonProperty("driver_price") String driverPrice,
    @JsonProperty("savings") String savings
) {

    static Financials of(Double driverPrice, Double savings) {
        return new Financials(dollars(driverPrice), dollars(savings));
    }

    private static String dollars(Double value) {
        return String.format(Locale.ROOT, "$%.2f", value == null ? 0.0 : value);
    }
}

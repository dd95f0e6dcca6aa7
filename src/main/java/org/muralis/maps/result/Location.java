package org.muralis.maps.result;

import java.math.BigDecimal;

/**
 * A latitude/longitude pair, used both as tool input (nearby search centre) and output.
 */
public record Location(double lat, double lng) {

    /** Provider query form, {@code "lat,lng"}, in plain decimal notation. */
    public String toQueryValue() {
        return plain(lat) + "," + plain(lng);
    }

    private static String plain(double coordinate) {
        return BigDecimal.valueOf(coordinate).stripTrailingZeros().toPlainString();
    }
}

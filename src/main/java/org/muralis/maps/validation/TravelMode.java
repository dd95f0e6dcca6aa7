package org.muralis.maps.validation;

import org.muralis.maps.exception.ValidationException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Transport modes accepted by the directions and distance lookups.
 */
public enum TravelMode {
    DRIVING,
    WALKING,
    BICYCLING,
    TRANSIT;

    public static final TravelMode DEFAULT = DRIVING;

    /** Provider wire value, e.g. {@code "bicycling"}. */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a caller-supplied mode. {@code null} means the caller left it out and maps to
     * {@link #DEFAULT}; anything else must match a wire value exactly.
     *
     * @throws ValidationException if the value is not an allowed mode
     */
    public static TravelMode parse(String mode) {
        if (mode == null) {
            return DEFAULT;
        }
        for (TravelMode candidate : values()) {
            if (candidate.value().equals(mode)) {
                return candidate;
            }
        }
        throw new ValidationException("modes", mode, allowedValues());
    }

    public static List<String> allowedValues() {
        return Arrays.stream(values()).map(TravelMode::value).toList();
    }
}

package org.muralis.maps.validation;

import org.muralis.maps.exception.ValidationException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * How the find-place lookup interprets its input: free text or a phone number.
 */
public enum PlaceQueryType {
    TEXTQUERY,
    PHONENUMBER;

    public static final PlaceQueryType DEFAULT = TEXTQUERY;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws ValidationException if the value is neither {@code textquery} nor {@code phonenumber}
     */
    public static PlaceQueryType parse(String inputType) {
        if (inputType == null) {
            return DEFAULT;
        }
        for (PlaceQueryType candidate : values()) {
            if (candidate.value().equals(inputType)) {
                return candidate;
            }
        }
        throw new ValidationException("input types", inputType, allowedValues());
    }

    public static List<String> allowedValues() {
        return Arrays.stream(values()).map(PlaceQueryType::value).toList();
    }
}

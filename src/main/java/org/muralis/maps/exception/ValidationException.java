package org.muralis.maps.exception;

import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when a tool argument is outside its fixed set of allowed values.
 */
@Getter
public class ValidationException extends RuntimeException {

    private final String rejectedValue;
    private final List<String> allowedValues;

    public ValidationException(String description, String rejectedValue, List<String> allowedValues) {
        super("ERROR: '" + rejectedValue + "' is not one of the allowed " + description + ": "
                + allowedValues.stream().map(v -> "'" + v + "'").collect(Collectors.joining(", ", "[", "]")));
        this.rejectedValue = rejectedValue;
        this.allowedValues = List.copyOf(allowedValues);
    }
}

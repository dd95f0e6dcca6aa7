package org.muralis.maps.result;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Structured failure returned to tool callers. Validation failures carry no {@code type};
 * provider failures are tagged so callers can tell them apart from bad input.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorPayload(String error, String type) {

    public static final String PROVIDER_UNAVAILABLE = "provider_unavailable";
    public static final String PROVIDER_REJECTED = "provider_rejected";
    public static final String INTERNAL_ERROR = "internal_error";

    public static ErrorPayload validation(String message) {
        return new ErrorPayload(message, null);
    }

    public static ErrorPayload providerUnavailable(String message) {
        return new ErrorPayload(message, PROVIDER_UNAVAILABLE);
    }

    public static ErrorPayload providerRejected(String message) {
        return new ErrorPayload(message, PROVIDER_REJECTED);
    }

    public static ErrorPayload internalError(String message) {
        return new ErrorPayload(message, INTERNAL_ERROR);
    }
}

package org.muralis.maps.result;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Top find-place candidate. {@code rating} and {@code location} serialize as {@code null} when unknown.
 */
public record PlaceSummary(
        String name,
        @JsonProperty("place_id") String placeId,
        @JsonProperty("formatted_address") String formattedAddress,
        Location location,
        List<String> types,
        Double rating
) {
}

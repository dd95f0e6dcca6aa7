package org.muralis.maps.result;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DistanceResult(
        @JsonProperty("total_distance") String totalDistance,
        @JsonProperty("total_duration") String totalDuration
) {
}

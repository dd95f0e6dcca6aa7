package org.muralis.maps.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Totals are those of the route's first leg; {@code steps} spans every leg in order.
 */
public record DirectionsResult(
        @JsonInclude(JsonInclude.Include.NON_NULL) String summary,
        @JsonProperty("total_distance") String totalDistance,
        @JsonProperty("total_duration") String totalDuration,
        List<RouteStep> steps
) {
}

package org.muralis.maps.shaper;

import org.muralis.maps.model.FindPlaceResponse;
import org.muralis.maps.model.PlaceResult;
import org.muralis.maps.result.PlaceSummary;
import org.muralis.maps.result.ToolResponse;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Summarises the provider's most relevant candidate.
 */
@Component
public class FindPlaceShaper implements ResponseShaper<FindPlaceResponse> {

    public static final String NOT_FOUND = "No such place found";

    @Override
    public ToolResponse shape(FindPlaceResponse response) {
        if (response == null || response.getCandidates() == null || response.getCandidates().isEmpty()) {
            return ToolResponse.notFound(NOT_FOUND);
        }
        PlaceResult place = response.getCandidates().get(0);
        return ToolResponse.of(new PlaceSummary(
                place.getName(),
                place.getPlaceId(),
                place.getFormattedAddress(),
                GeocodeShaper.toLocation(place.getGeometry()),
                place.getTypes() == null ? List.of() : place.getTypes(),
                place.getRating()));
    }
}

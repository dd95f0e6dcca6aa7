package org.muralis.maps.shaper;

import org.muralis.maps.model.PlaceResult;
import org.muralis.maps.model.PlacesNearbyResponse;
import org.muralis.maps.result.ToolResponse;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds a name to place-id index of nearby results in provider order.
 * A later result with an already-seen name replaces the earlier place id. A body with neither
 * status nor results counts as no response at all.
 */
@Component
public class PlacesNearbyShaper implements ResponseShaper<PlacesNearbyResponse> {

    public static final String NOT_FOUND = "Nothing nearby that matches the search criteria was found.";

    @Override
    public ToolResponse shape(PlacesNearbyResponse response) {
        if (response == null || (response.getStatus() == null && response.getResults() == null)) {
            return ToolResponse.notFound(NOT_FOUND);
        }
        Map<String, String> placeIdsByName = new LinkedHashMap<>();
        if (response.getResults() != null) {
            for (PlaceResult place : response.getResults()) {
                if (place.getName() != null && place.getPlaceId() != null) {
                    placeIdsByName.put(place.getName(), place.getPlaceId());
                }
            }
        }
        return ToolResponse.of(placeIdsByName);
    }
}

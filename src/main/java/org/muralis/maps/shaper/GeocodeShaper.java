package org.muralis.maps.shaper;

import org.muralis.maps.model.Geometry;
import org.muralis.maps.model.GeocodingResponse;
import org.muralis.maps.result.Location;
import org.muralis.maps.result.ToolResponse;
import org.springframework.stereotype.Component;

@Component
public class GeocodeShaper implements ResponseShaper<GeocodingResponse> {

    public static final String NOT_FOUND = "Address not found";

    @Override
    public ToolResponse shape(GeocodingResponse response) {
        if (response == null || response.getResults() == null || response.getResults().isEmpty()) {
            return ToolResponse.notFound(NOT_FOUND);
        }
        Location location = toLocation(response.getResults().get(0).getGeometry());
        return location == null ? ToolResponse.notFound(NOT_FOUND) : ToolResponse.of(location);
    }

    /** Null unless the geometry carries both coordinates. */
    static Location toLocation(Geometry geometry) {
        if (geometry == null || geometry.getLocation() == null) {
            return null;
        }
        Geometry.LatLng latLng = geometry.getLocation();
        if (latLng.getLat() == null || latLng.getLng() == null) {
            return null;
        }
        return new Location(latLng.getLat(), latLng.getLng());
    }
}

package org.muralis.maps.shaper;

import org.muralis.maps.model.PlaceDetailsResponse;
import org.muralis.maps.model.PlaceResult;
import org.muralis.maps.result.PlaceDetail;
import org.muralis.maps.result.ToolResponse;
import org.springframework.stereotype.Component;

/**
 * Emits the non-null subset of a place's details. {@code user_ratings_total} defaults to 0.
 */
@Component
public class PlaceDetailsShaper implements ResponseShaper<PlaceDetailsResponse> {

    public static final String NOT_FOUND = "No such place found.";
    public static final String NO_DETAILS = "No details found for the specified place.";
    public static final String MISSING_NAME = "Essential place details (e.g. name) are missing.";

    @Override
    public ToolResponse shape(PlaceDetailsResponse response) {
        if (response == null) {
            return ToolResponse.notFound(NOT_FOUND);
        }
        PlaceResult place = response.getResult();
        if (place == null || place.getPropertyCount() == 0) {
            return ToolResponse.notFound(NO_DETAILS);
        }
        if (place.getName() == null) {
            return ToolResponse.notFound(MISSING_NAME);
        }
        return ToolResponse.of(new PlaceDetail(
                place.getName(),
                place.getFormattedAddress(),
                place.getFormattedPhoneNumber(),
                place.getWebsite(),
                place.getTypes(),
                place.getRating(),
                place.getUserRatingsTotal() == null ? 0 : place.getUserRatingsTotal()));
    }
}

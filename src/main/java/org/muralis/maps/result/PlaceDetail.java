package org.muralis.maps.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlaceDetail(
        String name,
        @JsonProperty("formatted_address") String formattedAddress,
        @JsonProperty("formatted_phone_number") String formattedPhoneNumber,
        String website,
        List<String> types,
        Double rating,
        @JsonProperty("user_ratings_total") int userRatingsTotal
) {
}

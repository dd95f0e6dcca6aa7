package org.muralis.maps.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * A place as returned by find-place candidates, nearby-search results and place details.
 * Which fields are populated depends on the lookup and the requested field mask.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlaceResult {

    private String name;

    @JsonProperty("place_id")
    private String placeId;

    @JsonProperty("formatted_address")
    private String formattedAddress;

    @JsonProperty("formatted_phone_number")
    private String formattedPhoneNumber;

    private String website;

    private Geometry geometry;

    private List<String> types;

    private Double rating;

    @JsonProperty("user_ratings_total")
    private Integer userRatingsTotal;

    /** Number of properties in the source JSON object; only set by {@link PlaceResultDeserializer}. */
    @JsonIgnore
    private int propertyCount;
}

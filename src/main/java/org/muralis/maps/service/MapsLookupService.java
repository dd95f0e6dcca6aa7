package org.muralis.maps.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.muralis.maps.client.GoogleMapsClient;
import org.muralis.maps.result.Location;
import org.muralis.maps.result.ToolResponse;
import org.muralis.maps.shaper.DirectionsShaper;
import org.muralis.maps.shaper.DistanceShaper;
import org.muralis.maps.shaper.FindPlaceShaper;
import org.muralis.maps.shaper.GeocodeShaper;
import org.muralis.maps.shaper.PlaceDetailsShaper;
import org.muralis.maps.shaper.PlacesNearbyShaper;
import org.muralis.maps.validation.PlaceQueryType;
import org.muralis.maps.validation.TravelMode;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Validates arguments, performs the provider lookup and shapes the response.
 * Validation always runs before the provider is contacted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MapsLookupService {

    public static final List<String> DEFAULT_FIND_PLACE_FIELDS = List.of(
            "place_id", "formatted_address", "name", "geometry", "types", "rating");

    public static final List<String> DEFAULT_PLACE_DETAILS_FIELDS = List.of(
            "name", "formatted_address", "formatted_phone_number", "website", "types", "rating",
            "user_ratings_total");

    private final GoogleMapsClient mapsClient;
    private final DirectionsShaper directionsShaper;
    private final DistanceShaper distanceShaper;
    private final GeocodeShaper geocodeShaper;
    private final FindPlaceShaper findPlaceShaper;
    private final PlacesNearbyShaper placesNearbyShaper;
    private final PlaceDetailsShaper placeDetailsShaper;

    public ToolResponse directions(String origin, String destination, String mode) {
        TravelMode travelMode = TravelMode.parse(mode);
        return directionsShaper.shape(mapsClient.directions(origin, destination, travelMode));
    }

    public ToolResponse distance(String origin, String destination, String mode) {
        TravelMode travelMode = TravelMode.parse(mode);
        return distanceShaper.shape(mapsClient.distanceMatrix(origin, destination, travelMode));
    }

    public ToolResponse geocode(String address) {
        return geocodeShaper.shape(mapsClient.geocode(address));
    }

    public ToolResponse findPlace(String input, String inputType, List<String> fields) {
        PlaceQueryType queryType = PlaceQueryType.parse(inputType);
        return findPlaceShaper.shape(mapsClient.findPlace(input, queryType, fieldsOrDefault(fields, DEFAULT_FIND_PLACE_FIELDS)));
    }

    public ToolResponse placesNearby(Location location, int radius, String placeType) {
        return placesNearbyShaper.shape(mapsClient.placesNearby(location, radius, placeType));
    }

    public ToolResponse placeDetails(String placeId, List<String> fields) {
        return placeDetailsShaper.shape(mapsClient.place(placeId, fieldsOrDefault(fields, DEFAULT_PLACE_DETAILS_FIELDS)));
    }

    private static List<String> fieldsOrDefault(List<String> fields, List<String> defaults) {
        if (fields == null || fields.isEmpty()) {
            log.debug("No fields requested, using defaults {}", defaults);
            return defaults;
        }
        return fields;
    }
}

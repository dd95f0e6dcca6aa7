package org.muralis.maps.client;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.muralis.maps.exception.ApiException;
import org.muralis.maps.exception.IrrecoverableApiException;
import org.muralis.maps.exception.RecoverableApiException;
import org.muralis.maps.model.DirectionsResponse;
import org.muralis.maps.model.DistanceMatrixResponse;
import org.muralis.maps.model.FindPlaceResponse;
import org.muralis.maps.model.GeocodingResponse;
import org.muralis.maps.model.PlaceDetailsResponse;
import org.muralis.maps.model.PlacesNearbyResponse;
import org.muralis.maps.model.ProviderStatus;
import org.muralis.maps.result.Location;
import org.muralis.maps.validation.PlaceQueryType;
import org.muralis.maps.validation.TravelMode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;

/**
 * Thin client over the Google Maps Platform JSON web services.
 * <p>
 * Every method performs one GET and returns the deserialized body, or {@code null} when the
 * provider reports {@code NOT_FOUND}. Transient failures raise {@link RecoverableApiException}
 * and are retried once; rejected requests raise {@link IrrecoverableApiException}.
 */
@Slf4j
@Component
public class GoogleMapsClient {

    static final String DIRECTIONS_PATH = "/maps/api/directions/json";
    static final String DISTANCE_MATRIX_PATH = "/maps/api/distancematrix/json";
    static final String GEOCODE_PATH = "/maps/api/geocode/json";
    static final String FIND_PLACE_PATH = "/maps/api/place/findplacefromtext/json";
    static final String NEARBY_SEARCH_PATH = "/maps/api/place/nearbysearch/json";
    static final String PLACE_DETAILS_PATH = "/maps/api/place/details/json";

    private final RestClient restClient;
    private final String apiKey;

    public GoogleMapsClient(RestClient restClient, @Value("${app.google-maps.api-key}") String apiKey) {
        this.restClient = restClient;
        this.apiKey = apiKey;
    }

    @CircuitBreaker(name = "googleMaps")
    @Retry(name = "googleMaps")
    public DirectionsResponse directions(String origin, String destination, TravelMode mode) {
        log.info("Fetching directions: origin={}, destination={}, mode={}", origin, destination, mode.value());
        return get("directions", DirectionsResponse.class,
                DIRECTIONS_PATH + "?origin={origin}&destination={destination}&mode={mode}&key={key}",
                origin, destination, mode.value(), apiKey);
    }

    @CircuitBreaker(name = "googleMaps")
    @Retry(name = "googleMaps")
    public DistanceMatrixResponse distanceMatrix(String origin, String destination, TravelMode mode) {
        log.info("Fetching distance matrix: origin={}, destination={}, mode={}", origin, destination, mode.value());
        return get("distance matrix", DistanceMatrixResponse.class,
                DISTANCE_MATRIX_PATH + "?origins={origins}&destinations={destinations}&mode={mode}&key={key}",
                origin, destination, mode.value(), apiKey);
    }

    @CircuitBreaker(name = "googleMaps")
    @Retry(name = "googleMaps")
    public GeocodingResponse geocode(String address) {
        log.info("Geocoding address: {}", address);
        return get("geocoding", GeocodingResponse.class,
                GEOCODE_PATH + "?address={address}&key={key}",
                address, apiKey);
    }

    @CircuitBreaker(name = "googleMaps")
    @Retry(name = "googleMaps")
    public FindPlaceResponse findPlace(String input, PlaceQueryType inputType, List<String> fields) {
        log.info("Finding place: input={}, inputType={}, fields={}", input, inputType.value(), fields);
        return get("find place", FindPlaceResponse.class,
                FIND_PLACE_PATH + "?input={input}&inputtype={inputtype}&fields={fields}&key={key}",
                input, inputType.value(), String.join(",", fields), apiKey);
    }

    @CircuitBreaker(name = "googleMaps")
    @Retry(name = "googleMaps")
    public PlacesNearbyResponse placesNearby(Location location, int radius, String keyword) {
        log.info("Searching nearby: location={}, radius={}, keyword={}", location.toQueryValue(), radius, keyword);
        return get("nearby search", PlacesNearbyResponse.class,
                NEARBY_SEARCH_PATH + "?location={location}&radius={radius}&keyword={keyword}&key={key}",
                location.toQueryValue(), radius, keyword, apiKey);
    }

    @CircuitBreaker(name = "googleMaps")
    @Retry(name = "googleMaps")
    public PlaceDetailsResponse place(String placeId, List<String> fields) {
        log.info("Fetching place details: placeId={}, fields={}", placeId, fields);
        return get("place details", PlaceDetailsResponse.class,
                PLACE_DETAILS_PATH + "?place_id={placeId}&fields={fields}&key={key}",
                placeId, String.join(",", fields), apiKey);
    }

    private <T extends ProviderStatus> T get(String operation, Class<T> responseType,
                                             String uriTemplate, Object... uriVariables) {
        T response;
        try {
            response = restClient.get()
                    .uri(uriTemplate, uriVariables)
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, (request, httpResponse) -> {
                        String msg = "Invalid " + operation + " request: " + httpResponse.getStatusCode();
                        throw new IrrecoverableApiException(msg);
                    })
                    .onStatus(HttpStatusCode::is5xxServerError, (request, httpResponse) -> {
                        String msg = "Google Maps " + operation + " service unavailable: "
                                + httpResponse.getStatusCode();
                        throw new RecoverableApiException(msg);
                    })
                    .body(responseType);
        } catch (Exception e) {
            if (e instanceof ApiException apiException) {
                throw apiException;
            }
            log.error("Network error calling Google Maps {} API", operation, e);
            throw new RecoverableApiException("Network error calling Google Maps " + operation + " API", e);
        }
        return checkStatus(operation, response);
    }

    private <T extends ProviderStatus> T checkStatus(String operation, T response) {
        if (response == null) {
            return null;
        }
        String status = response.getStatus();
        if (status == null || ProviderStatus.STATUS_OK.equals(status)
                || ProviderStatus.STATUS_ZERO_RESULTS.equals(status)) {
            return response;
        }
        if (ProviderStatus.STATUS_NOT_FOUND.equals(status)) {
            log.info("Google Maps {} lookup returned NOT_FOUND", operation);
            return null;
        }

        String msg = "Google Maps " + operation + " request failed with status " + status
                + (response.getErrorMessage() == null ? "" : ": " + response.getErrorMessage());
        if (ProviderStatus.STATUS_OVER_QUERY_LIMIT.equals(status)
                || ProviderStatus.STATUS_UNKNOWN_ERROR.equals(status)) {
            log.warn(msg);
            throw new RecoverableApiException(msg);
        }
        log.error(msg);
        throw new IrrecoverableApiException(msg);
    }
}

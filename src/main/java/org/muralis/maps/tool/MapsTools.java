package org.muralis.maps.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.muralis.maps.exception.IrrecoverableApiException;
import org.muralis.maps.exception.RecoverableApiException;
import org.muralis.maps.exception.ValidationException;
import org.muralis.maps.result.ErrorPayload;
import org.muralis.maps.result.Location;
import org.muralis.maps.result.ToolResponse;
import org.muralis.maps.service.MapsLookupService;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Supplier;

/**
 * MCP tool surface. Each tool returns compact JSON for results and errors, or a plain sentence
 * when nothing was found; no per-call failure escapes as an exception.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MapsTools {

    static final String SERIALIZATION_FAILURE =
            "{\"error\":\"Failed to serialize tool response\",\"type\":\"internal_error\"}";

    private final MapsLookupService lookupService;
    private final ObjectMapper objectMapper;

    @Tool(name = "get_directions",
            description = "Gives step-by-step instructions to get from origin to destination using a particular "
                    + "mode of transport. Returns the total distance, total duration and the list of steps.",
            resultConverter = PlainTextResultConverter.class)
    public String getDirections(
            @ToolParam(description = "Originating address or place name") String origin,
            @ToolParam(description = "Destination address or place name") String destination,
            @ToolParam(description = "Mode of transportation: driving, walking, bicycling or transit. Defaults to driving",
                    required = false) String mode) {
        return respond("get_directions", () -> lookupService.directions(origin, destination, mode));
    }

    @Tool(name = "get_distance",
            description = "Gives the total travel distance and duration between origin and destination "
                    + "for a particular mode of transport.",
            resultConverter = PlainTextResultConverter.class)
    public String getDistance(
            @ToolParam(description = "Originating address or place name") String origin,
            @ToolParam(description = "Destination address or place name") String destination,
            @ToolParam(description = "Mode of transportation: driving, walking, bicycling or transit. Defaults to driving",
                    required = false) String mode) {
        return respond("get_distance", () -> lookupService.distance(origin, destination, mode));
    }

    @Tool(name = "get_geocode",
            description = "Converts an address or place name into latitude and longitude.",
            resultConverter = PlainTextResultConverter.class)
    public String getGeocode(
            @ToolParam(description = "Address or place name to locate") String address) {
        return respond("get_geocode", () -> lookupService.geocode(address));
    }

    @Tool(name = "find_place",
            description = "Finds the best matching place for a text or phone number query and returns its name, "
                    + "place_id, address, location, types and rating.",
            resultConverter = PlainTextResultConverter.class)
    public String findPlace(
            @ToolParam(description = "Name of the place, ideally with city and country. "
                    + "Can also be an establishment type such as bakery or bank") String input,
            @ToolParam(description = "Type of query: textquery or phonenumber. Defaults to textquery",
                    required = false) String inputType,
            @ToolParam(description = "Place fields to request. Defaults to place_id, formatted_address, name, "
                    + "geometry, types and rating", required = false) List<String> fields) {
        return respond("find_place", () -> lookupService.findPlace(input, inputType, fields));
    }

    @Tool(name = "place_nearby",
            description = "Finds places of a given type within a radius of a location. "
                    + "Returns a mapping of establishment names to their place_id.",
            resultConverter = PlainTextResultConverter.class)
    public String placeNearby(
            @ToolParam(description = "Centre of the search, with lat and lng") Location location,
            @ToolParam(description = "Search radius in meters, e.g. 2500 for 2.5 km") int radius,
            @ToolParam(description = "Kind of place to look for, e.g. italian restaurant or hotel") String placeType) {
        return respond("place_nearby", () -> lookupService.placesNearby(location, radius, placeType));
    }

    @Tool(name = "place_details",
            description = "Returns details of a place obtained from find_place or place_nearby: name, address, "
                    + "phone number, website, types, rating and total rating count.",
            resultConverter = PlainTextResultConverter.class)
    public String placeDetails(
            @ToolParam(description = "place_id of the place") String placeId,
            @ToolParam(description = "Place fields to request. Defaults to name, formatted_address, "
                    + "formatted_phone_number, website, types, rating and user_ratings_total",
                    required = false) List<String> fields) {
        return respond("place_details", () -> lookupService.placeDetails(placeId, fields));
    }

    String respond(String toolName, Supplier<ToolResponse> lookup) {
        log.info("Tool call: {}", toolName);
        ToolResponse response;
        try {
            response = lookup.get();
        } catch (ValidationException e) {
            log.warn("Rejected {} call: {}", toolName, e.getMessage());
            response = ToolResponse.error(ErrorPayload.validation(e.getMessage()));
        } catch (RecoverableApiException | CallNotPermittedException e) {
            log.warn("Google Maps unavailable for {}: {}", toolName, e.getMessage());
            response = ToolResponse.error(ErrorPayload.providerUnavailable(e.getMessage()));
        } catch (IrrecoverableApiException e) {
            log.error("Google Maps rejected {}: {}", toolName, e.getMessage());
            response = ToolResponse.error(ErrorPayload.providerRejected(e.getMessage()));
        } catch (Exception e) {
            log.error("Unexpected error in {}", toolName, e);
            response = ToolResponse.error(ErrorPayload.internalError("Unexpected error in " + toolName + ": " + e.getMessage()));
        }

        if (response.isNotFound()) {
            log.info("{} found nothing: {}", toolName, response.getMessage());
        }
        try {
            return response.render(objectMapper);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} response", toolName, e);
            return SERIALIZATION_FAILURE;
        }
    }
}

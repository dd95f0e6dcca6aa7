package org.muralis.maps.shaper;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.muralis.maps.model.GeocodingResponse;
import org.muralis.maps.result.Location;
import org.muralis.maps.result.ToolResponse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeocodeShaperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final GeocodeShaper shaper = new GeocodeShaper();

    @Test
    void emitsFirstResultCoordinates() throws Exception {
        GeocodingResponse response = objectMapper.readValue("""
                {"status": "OK", "results": [
                  {"formatted_address": "1600 Amphitheatre Pkwy", "place_id": "ChIJ2eUgeAK6j4ARbn5u_wAGqWA", "geometry": {"location": {"lat": 37.7749, "lng": -122.4194}}},
                  {"geometry": {"location": {"lat": 1.0, "lng": 2.0}}}
                ]}
                """, GeocodingResponse.class);

        ToolResponse shaped = shaper.shape(response);

        assertEquals(new Location(37.7749, -122.4194), shaped.getPayload());
        assertEquals("{\"lat\":37.7749,\"lng\":-122.4194}", shaped.render(objectMapper));
    }

    @Test
    void emptyResultsIsAddressNotFound() throws Exception {
        ToolResponse shaped = shaper.shape(objectMapper.readValue("{\"results\": []}", GeocodingResponse.class));

        assertTrue(shaped.isNotFound());
        assertEquals("Address not found", shaped.render(objectMapper));
    }

    @Test
    void resultWithoutLocationIsAddressNotFound() throws Exception {
        GeocodingResponse response = objectMapper.readValue(
                "{\"results\": [{\"geometry\": {\"location\": {\"lat\": 1.5}}}]}", GeocodingResponse.class);

        assertEquals(GeocodeShaper.NOT_FOUND, shaper.shape(response).getMessage());
        assertEquals(GeocodeShaper.NOT_FOUND, shaper.shape(null).getMessage());
    }
}

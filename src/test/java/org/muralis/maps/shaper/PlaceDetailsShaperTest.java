package org.muralis.maps.shaper;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.muralis.maps.model.PlaceDetailsResponse;
import org.muralis.maps.result.PlaceDetail;
import org.muralis.maps.result.ToolResponse;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PlaceDetailsShaperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PlaceDetailsShaper shaper = new PlaceDetailsShaper();

    @Test
    void emitsAllKnownDetails() throws Exception {
        PlaceDetailsResponse response = objectMapper.readValue("""
                {"status": "OK", "result": {
                  "name": "TechPark Cafe",
                  "formatted_address": "123 Innovation Drive, Tech City",
                  "formatted_phone_number": "555-0100",
                  "website": "http://techparkcafe.example.com",
                  "types": ["cafe", "food", "point_of_interest", "establishment"],
                  "rating": 4.7,
                  "user_ratings_total": 150
                }}
                """, PlaceDetailsResponse.class);

        ToolResponse shaped = shaper.shape(response);

        assertEquals(new PlaceDetail(
                "TechPark Cafe",
                "123 Innovation Drive, Tech City",
                "555-0100",
                "http://techparkcafe.example.com",
                List.of("cafe", "food", "point_of_interest", "establishment"),
                4.7,
                150), shaped.getPayload());
    }

    @Test
    void dropsNullFieldsAndDefaultsRatingCount() throws Exception {
        PlaceDetailsResponse response = objectMapper.readValue(
                "{\"result\": {\"name\": \"Quiet Park\", \"website\": null}}", PlaceDetailsResponse.class);

        assertEquals("{\"name\":\"Quiet Park\",\"user_ratings_total\":0}", shaper.shape(response).render(objectMapper));
    }

    @Test
    void emptyResultHasNoDetails() throws Exception {
        PlaceDetailsResponse response = objectMapper.readValue("{\"result\": {}}", PlaceDetailsResponse.class);

        assertEquals("No details found for the specified place.", shaper.shape(response).getMessage());
    }

    @Test
    void resultWithoutNameIsMissingEssentials() throws Exception {
        PlaceDetailsResponse response = objectMapper.readValue(
                "{\"result\": {\"formatted_address\": \"X\"}}", PlaceDetailsResponse.class);

        assertEquals("Essential place details (e.g. name) are missing.", shaper.shape(response).getMessage());
    }

    @Test
    void nullNameStillCountsAsDetails() throws Exception {
        PlaceDetailsResponse response = objectMapper.readValue("{\"result\": {\"name\": null}}", PlaceDetailsResponse.class);

        assertEquals("Essential place details (e.g. name) are missing.", shaper.shape(response).getMessage());
    }

    @Test
    void unmodelledPropertyStillCountsAsDetails() throws Exception {
        PlaceDetailsResponse response = objectMapper.readValue(
                "{\"result\": {\"url\": \"https://maps.google.com/?cid=1\"}}", PlaceDetailsResponse.class);

        assertEquals("Essential place details (e.g. name) are missing.", shaper.shape(response).getMessage());
    }

    @Test
    void missingResultHasNoDetails() {
        assertEquals("No details found for the specified place.", shaper.shape(new PlaceDetailsResponse()).getMessage());
    }

    @Test
    void missingResponseIsNoSuchPlace() {
        assertEquals("No such place found.", shaper.shape(null).getMessage());
    }
}

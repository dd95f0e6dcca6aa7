package org.muralis.maps.shaper;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.muralis.maps.model.DistanceMatrixResponse;
import org.muralis.maps.result.DistanceResult;
import org.muralis.maps.result.ToolResponse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DistanceShaperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final DistanceShaper shaper = new DistanceShaper();

    @Test
    void readsFirstElement() throws Exception {
        DistanceMatrixResponse response = objectMapper.readValue("""
                {"status": "OK", "rows": [{"elements": [
                  {"status": "OK", "distance": {"text": "50 km", "value": 50000}, "duration": {"text": "1 hour", "value": 3600}}
                ]}]}
                """, DistanceMatrixResponse.class);

        ToolResponse shaped = shaper.shape(response);

        assertEquals(new DistanceResult("50 km", "1 hour"), shaped.getPayload());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"rows\": []}",
            "{}",
            "{\"rows\": [{\"elements\": []}]}",
            "{\"rows\": [{}]}",
            "{\"rows\": [{\"elements\": [{\"status\": \"ZERO_RESULTS\"}]}]}",
            "{\"rows\": [{\"elements\": [{\"status\": \"NOT_FOUND\"}]}]}",
            "{\"rows\": [{\"elements\": [{\"status\": \"OK\", \"distance\": {\"text\": \"1 km\"}}]}]}"
    })
    void emptyOrIncompleteMatrixIsNotFound(String json) throws Exception {
        ToolResponse shaped = shaper.shape(objectMapper.readValue(json, DistanceMatrixResponse.class));

        assertTrue(shaped.isNotFound());
        assertEquals(DistanceShaper.NOT_FOUND, shaped.getMessage());
    }

    @Test
    void missingResponseIsNotFound() {
        assertEquals(DistanceShaper.NOT_FOUND, shaper.shape(null).getMessage());
    }
}

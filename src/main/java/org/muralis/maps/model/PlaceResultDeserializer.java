package org.muralis.maps.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

/**
 * Binds a place object and records how many JSON properties it carried, including
 * null-valued and unmodelled ones.
 */
public class PlaceResultDeserializer extends JsonDeserializer<PlaceResult> {

    @Override
    public PlaceResult deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.readValueAsTree();
        PlaceResult place = parser.getCodec().treeToValue(node, PlaceResult.class);
        place.setPropertyCount(node.size());
        return place;
    }
}

package org.muralis.maps.validation;

import org.junit.jupiter.api.Test;
import org.muralis.maps.exception.ValidationException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PlaceQueryTypeTest {

    @Test
    void acceptsTextAndPhoneQueries() {
        assertEquals(PlaceQueryType.TEXTQUERY, PlaceQueryType.parse("textquery"));
        assertEquals(PlaceQueryType.PHONENUMBER, PlaceQueryType.parse("phonenumber"));
    }

    @Test
    void missingTypeDefaultsToTextQuery() {
        assertEquals(PlaceQueryType.TEXTQUERY, PlaceQueryType.parse(null));
    }

    @Test
    void rejectsUnknownQueryType() {
        ValidationException e = assertThrows(ValidationException.class, () -> PlaceQueryType.parse("email"));

        assertEquals("ERROR: 'email' is not one of the allowed input types: ['textquery', 'phonenumber']",
                e.getMessage());
    }
}

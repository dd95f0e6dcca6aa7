package org.muralis.maps.validation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.muralis.maps.exception.ValidationException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TravelModeTest {

    @Test
    void acceptsEveryAllowedMode() {
        assertEquals(TravelMode.DRIVING, TravelMode.parse("driving"));
        assertEquals(TravelMode.WALKING, TravelMode.parse("walking"));
        assertEquals(TravelMode.BICYCLING, TravelMode.parse("bicycling"));
        assertEquals(TravelMode.TRANSIT, TravelMode.parse("transit"));
    }

    @Test
    void missingModeDefaultsToDriving() {
        assertEquals(TravelMode.DRIVING, TravelMode.parse(null));
    }

    @ParameterizedTest
    @ValueSource(strings = {"flying", "teleportation", "", "Driving", " walking"})
    void rejectsValuesOutsideTheAllowedSet(String mode) {
        ValidationException e = assertThrows(ValidationException.class, () -> TravelMode.parse(mode));

        assertEquals(mode, e.getRejectedValue());
        assertEquals(List.of("driving", "walking", "bicycling", "transit"), e.getAllowedValues());
    }

    @Test
    void errorMessageNamesValueAndAllowedModes() {
        ValidationException e = assertThrows(ValidationException.class, () -> TravelMode.parse("flying"));

        assertEquals("ERROR: 'flying' is not one of the allowed modes: "
                + "['driving', 'walking', 'bicycling', 'transit']", e.getMessage());
    }
}

package org.muralis.maps.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Geometry {

    private LatLng location;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LatLng {
        private Double lat;
        private Double lng;
    }
}

package org.muralis.maps.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlacesNearbyResponse implements ProviderStatus {

    private String status;

    @JsonProperty("error_message")
    private String errorMessage;

    private List<PlaceResult> results;
}

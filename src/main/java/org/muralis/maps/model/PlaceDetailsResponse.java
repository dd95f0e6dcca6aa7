package org.muralis.maps.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlaceDetailsResponse implements ProviderStatus {

    private String status;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonDeserialize(using = PlaceResultDeserializer.class)
    private PlaceResult result;
}

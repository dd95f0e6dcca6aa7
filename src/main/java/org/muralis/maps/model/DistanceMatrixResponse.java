package org.muralis.maps.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DistanceMatrixResponse implements ProviderStatus {

    private String status;

    @JsonProperty("error_message")
    private String errorMessage;

    private List<Row> rows;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Row {
        private List<Element> elements;
    }

    /** One origin/destination pair; its status is independent of the envelope status. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Element {
        private String status;
        private TextValue distance;
        private TextValue duration;
    }
}

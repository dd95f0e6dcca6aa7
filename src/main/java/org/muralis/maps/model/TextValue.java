package org.muralis.maps.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * A distance or duration as the provider reports it: human-readable text plus the raw value.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TextValue {
    private String text;
    private Long value;

    public static String textOf(TextValue value) {
        return value == null ? null : value.getText();
    }
}

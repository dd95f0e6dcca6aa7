package org.muralis.maps.model;

/**
 * Envelope fields shared by every Google Maps web service response.
 */
public interface ProviderStatus {

    String STATUS_OK = "OK";
    String STATUS_ZERO_RESULTS = "ZERO_RESULTS";
    String STATUS_NOT_FOUND = "NOT_FOUND";
    String STATUS_OVER_QUERY_LIMIT = "OVER_QUERY_LIMIT";
    String STATUS_UNKNOWN_ERROR = "UNKNOWN_ERROR";

    String getStatus();

    String getErrorMessage();
}

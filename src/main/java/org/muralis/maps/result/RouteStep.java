package org.muralis.maps.result;

public record RouteStep(String instruction, String distance, String duration) {
}

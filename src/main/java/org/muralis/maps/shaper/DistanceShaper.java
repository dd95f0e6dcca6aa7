package org.muralis.maps.shaper;

import org.muralis.maps.model.DistanceMatrixResponse;
import org.muralis.maps.model.ProviderStatus;
import org.muralis.maps.result.DistanceResult;
import org.muralis.maps.result.ToolResponse;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reads the single origin/destination element of a distance matrix.
 */
@Component
public class DistanceShaper implements ResponseShaper<DistanceMatrixResponse> {

    public static final String NOT_FOUND = "No distance information found for the specified locations.";

    @Override
    public ToolResponse shape(DistanceMatrixResponse response) {
        if (response == null || isEmpty(response.getRows())) {
            return ToolResponse.notFound(NOT_FOUND);
        }
        List<DistanceMatrixResponse.Element> elements = response.getRows().get(0).getElements();
        if (isEmpty(elements)) {
            return ToolResponse.notFound(NOT_FOUND);
        }

        DistanceMatrixResponse.Element element = elements.get(0);
        if (ProviderStatus.STATUS_ZERO_RESULTS.equals(element.getStatus())
                || ProviderStatus.STATUS_NOT_FOUND.equals(element.getStatus())
                || element.getDistance() == null || element.getDistance().getText() == null
                || element.getDuration() == null || element.getDuration().getText() == null) {
            return ToolResponse.notFound(NOT_FOUND);
        }
        return ToolResponse.of(new DistanceResult(element.getDistance().getText(), element.getDuration().getText()));
    }

    private static boolean isEmpty(List<?> list) {
        return list == null || list.isEmpty();
    }
}

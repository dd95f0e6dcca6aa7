package org.muralis.maps.shaper;

import org.muralis.maps.model.DirectionsResponse;
import org.muralis.maps.model.TextValue;
import org.muralis.maps.result.DirectionsResult;
import org.muralis.maps.result.RouteStep;
import org.muralis.maps.result.ToolResponse;
import org.muralis.maps.util.TextNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Shapes the first returned route into totals plus a flat list of steps.
 * <p>
 * Totals reflect {@code legs[0]} only, even for multi-leg routes; callers rely on the
 * single-leg semantics of simple origin-to-destination queries. Steps cover every leg.
 */
@Component
public class DirectionsShaper implements ResponseShaper<DirectionsResponse> {

    public static final String NOT_FOUND = "No directions found for the specified locations.";

    @Override
    public ToolResponse shape(DirectionsResponse response) {
        if (response == null || response.getRoutes() == null || response.getRoutes().isEmpty()) {
            return ToolResponse.notFound(NOT_FOUND);
        }
        DirectionsResponse.Route route = response.getRoutes().get(0);
        List<DirectionsResponse.Leg> legs = route.getLegs();
        if (legs == null || legs.isEmpty()) {
            return ToolResponse.notFound(NOT_FOUND);
        }

        List<RouteStep> steps = new ArrayList<>();
        for (DirectionsResponse.Leg leg : legs) {
            if (leg.getSteps() == null) {
                continue;
            }
            for (DirectionsResponse.Step step : leg.getSteps()) {
                steps.add(new RouteStep(
                        TextNormalizer.stripMarkup(step.getHtmlInstructions()),
                        TextValue.textOf(step.getDistance()),
                        TextValue.textOf(step.getDuration())));
            }
        }

        DirectionsResponse.Leg firstLeg = legs.get(0);
        String summary = route.getSummary() == null || route.getSummary().isBlank() ? null : route.getSummary();
        return ToolResponse.of(new DirectionsResult(
                summary,
                TextValue.textOf(firstLeg.getDistance()),
                TextValue.textOf(firstLeg.getDuration()),
                steps));
    }
}

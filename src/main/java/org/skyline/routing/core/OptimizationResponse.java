package org.skyline.routing.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.skyline.routing.tour.TourMode;
import org.skyline.routing.tour.TourStrategy;

import java.util.List;

/**
 * Client-facing route optimization response.
 */
@Value
@Builder
public class OptimizationResponse {
    /** Full walk through the building in external node ids. */
    @Singular("pathNode")
    List<String> pathExternalNodeIds;
    /** Anchor visiting order in external node ids. */
    @Singular("tourNode")
    List<String> tourExternalNodeIds;
    /** Total route cost in edge-weight units. */
    double totalCost;
    TourStrategy strategy;
    TourMode tourMode;
    OptimizationTelemetry telemetry;
}

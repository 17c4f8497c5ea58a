package org.skyline.routing.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.skyline.routing.tour.TourMode;
import org.skyline.routing.tour.TourStrategy;

import java.util.List;

/**
 * Client-facing route optimization request.
 *
 * <p>Node identifiers are external ids. When {@code criticalNodeIds} is empty, every node flagged
 * critical in the graph is visited.</p>
 */
@Value
@Builder
public class OptimizationRequest {
    /** External id of the node the route starts at. */
    String startNodeId;
    /** Explicit destinations; empty means all critical nodes of the graph. */
    @Singular("criticalNodeId")
    List<String> criticalNodeIds;
    /** Tour solving strategy. */
    TourStrategy strategy;
    /** Tour shape; {@code null} uses the optimizer default. */
    TourMode tourMode;
}

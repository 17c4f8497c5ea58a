package org.skyline.routing.heuristic;

import lombok.experimental.UtilityClass;
import org.skyline.routing.graph.BuildingGraph;

/**
 * Creates heuristic providers with uniform validation.
 */
@UtilityClass
public final class HeuristicFactory {
    public static final String REASON_TYPE_REQUIRED = "HEURISTIC_TYPE_REQUIRED";
    public static final String REASON_GRAPH_REQUIRED = "HEURISTIC_GRAPH_REQUIRED";

    /**
     * Creates a provider of the requested type for one graph.
     *
     * @param type requested heuristic type.
     * @param graph graph to bind.
     * @return initialized provider.
     */
    public static HeuristicProvider create(HeuristicType type, BuildingGraph graph) {
        if (type == null) {
            throw new HeuristicConfigurationException(
                    REASON_TYPE_REQUIRED,
                    "heuristic type must be explicitly specified (NONE, EUCLIDEAN)"
            );
        }
        if (graph == null) {
            throw new HeuristicConfigurationException(REASON_GRAPH_REQUIRED, "graph must be provided");
        }
        return switch (type) {
            case NONE -> new NullHeuristicProvider(graph);
            case EUCLIDEAN -> new EuclideanHeuristicProvider(graph, GeometryLowerBoundModel.calibrateEuclidean(graph));
        };
    }
}

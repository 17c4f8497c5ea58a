package org.skyline.routing.heuristic;

/**
 * Heuristic provider contract used by path searches.
 *
 * <p>Providers are immutable and thread-safe; one provider may bind many goals concurrently.</p>
 */
public interface HeuristicProvider {

    /**
     * @return heuristic mode of this provider.
     */
    HeuristicType type();

    /**
     * Binds a concrete goal node and returns a reusable estimator.
     *
     * @param goalNodeId internal goal node id.
     * @return immutable estimator bound to the provided goal node.
     */
    GoalBoundHeuristic bindGoal(int goalNodeId);
}

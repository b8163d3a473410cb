package edu.uw.cse.typegraph.solver;

import java.util.List;

/**
 * Snapshot of a Solver's query log and state-cache statistics.
 */
public record SolverMetrics(List<QueryMetrics> queryMetrics, long cacheHits,
                            long cacheMisses, int cacheSize) {

    public static final SolverMetrics EMPTY = new SolverMetrics(List.of(), 0, 0, 0);

    public SolverMetrics {
        queryMetrics = List.copyOf(queryMetrics);
    }
}

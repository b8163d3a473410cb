package edu.uw.cse.typegraph.solver;

/**
 * Receives every finished search step of a Solver.
 */
@FunctionalInterface
public interface SolveListener {
    SolveListener NONE = step -> { };

    void onStep(SearchStep step);
}

package edu.uw.cse.typegraph.solver;

/**
 * Why a single search step ended the way it did.
 */
public enum Outcome {
    /** Every goal was traced back to its sources from this state. */
    SOLVED(false),
    /** Two goals need different bindings of the same variable. */
    CONFLICTING_GOALS(false),
    /** Every way of resolving the goals here requires conflicting source bindings. */
    CONFLICTING_SOURCES(false),
    /** No origin of the remaining goals is reachable without crossing a blocking assignment. */
    NO_REACHABLE_ORIGIN(false),
    /** Successor states exist but none of them is solvable. */
    EXHAUSTED(false),
    CACHED(true),
    /** Revisited a state still on the search path; answered by the cycle policy. */
    CYCLE(true);

    private final boolean recalled;

    Outcome(boolean recalled) {
        this.recalled = recalled;
    }

    public boolean isRecalled() {
        return recalled;
    }
}

package edu.uw.cse.typegraph.solver;

/**
 * Memo entry for a solver State.
 */
public enum SolveStatus {
    /** On the current search path; a revisit is a cycle. */
    IN_PROGRESS,
    SOLVABLE,
    UNSOLVABLE
}

package edu.uw.cse.typegraph;

/**
 * What a solver state that is still being explored answers when the search
 * reaches it again through a dependency cycle.
 */
public enum CyclePolicy {
    /** The revisit succeeds; the frame further up decides the real answer. */
    ASSUME_SOLVABLE,
    /** The revisit fails, so only acyclic derivations count as witnesses. */
    ASSUME_UNSOLVABLE
}

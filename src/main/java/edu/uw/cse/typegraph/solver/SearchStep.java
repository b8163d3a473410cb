package edu.uw.cse.typegraph.solver;

import edu.uw.cse.typegraph.graph.Binding;
import edu.uw.cse.typegraph.graph.CfgNode;

import java.util.List;

/**
 * One state the solver looked at. {@code sequence} is the order in which the
 * state was entered; steps are reported when they finish.
 */
public record SearchStep(int sequence, CfgNode position, List<Binding> goals,
                         int depth, Outcome outcome, boolean solvable) {

    public SearchStep {
        goals = List.copyOf(goals);
    }

    public boolean isFailure() {
        return !solvable && !outcome.isRecalled();
    }
}

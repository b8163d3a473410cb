package edu.uw.cse.typegraph.graph;

import edu.uw.cse.typegraph.solver.SolverMetrics;

import java.util.List;

/**
 * Snapshot of a Program's size and of its Solver's work so far.
 */
public record ProgramMetrics(int bindingCount,
                             List<NodeMetrics> nodeMetrics,
                             List<VariableMetrics> variableMetrics,
                             SolverMetrics solverMetrics) {

    public ProgramMetrics {
        nodeMetrics = List.copyOf(nodeMetrics);
        variableMetrics = List.copyOf(variableMetrics);
    }

    public record NodeMetrics(int incomingEdgeCount, int outgoingEdgeCount, boolean hasCondition) {
    }

    /** {@code nodeIds} lists the nodes at which the variable is assigned. */
    public record VariableMetrics(int bindingCount, List<Integer> nodeIds) {
        public VariableMetrics {
            nodeIds = List.copyOf(nodeIds);
        }
    }
}

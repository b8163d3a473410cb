package edu.uw.cse.typegraph.solver;

import edu.uw.cse.typegraph.graph.Binding;
import edu.uw.cse.typegraph.graph.CfgNode;
import edu.uw.cse.typegraph.graph.Program;

import java.util.*;

/**
 * Replays a combination query with a private Solver that records every step.
 * The Program's own Solver and its caches are never touched.
 */
public class Explainer {
    private final Program program;

    public Explainer(Program program) {
        this.program = Objects.requireNonNull(program);
    }

    public Explanation explain(Collection<Binding> goals, CfgNode at) {
        List<SearchStep> steps = new ArrayList<>();
        Solver scratch = new Solver(program, steps::add);
        List<Binding> sorted = new ArrayList<>(new TreeSet<>(goals));

        Binding infeasible = null;
        if (sorted.size() > 1) {
            for (Binding goal : sorted) {
                if (!scratch.solve(List.of(goal), at)) {
                    infeasible = goal;
                    break;
                }
            }
        }
        boolean solvable = infeasible == null && scratch.solve(sorted, at);
        if (!solvable && sorted.size() == 1) {
            infeasible = sorted.get(0);
        }
        return new Explanation(at, sorted, solvable, infeasible, steps);
    }
}
